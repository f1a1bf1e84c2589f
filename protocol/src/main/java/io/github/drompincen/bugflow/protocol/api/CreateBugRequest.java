package io.github.drompincen.bugflow.protocol.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Set;

/**
 * A status passed in here is ignored: new bugs always start {@code Open} and
 * unvalidated.
 */
public record CreateBugRequest(
        @NotBlank(message = "Bug title is required")
        @Size(max = 200, message = "Bug title must be 200 characters or less")
        String title,
        @NotBlank(message = "Bug description is required")
        @Size(max = 5000, message = "Bug description must be 5000 characters or less")
        String description,
        @NotBlank(message = "Project ID is required")
        String projectId,
        @NotBlank(message = "Reporter user ID is required")
        String reportedBy,
        @NotNull(message = "Reporter role is required")
        UserRole userRole,
        BugPriority priority,
        BugSeverity severity,
        BugType type,
        Set<BugTag> tags,
        BugStatus status,
        String assignedTo,
        String sprintId,
        List<String> attachments
) {}

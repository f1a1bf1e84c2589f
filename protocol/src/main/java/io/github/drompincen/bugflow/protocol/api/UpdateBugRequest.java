package io.github.drompincen.bugflow.protocol.api;

import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Partial update of the descriptive fields. Null means "leave unchanged".
 */
public record UpdateBugRequest(
        @Size(min = 1, max = 200) String title,
        @Size(min = 1, max = 5000) String description,
        BugPriority priority,
        BugSeverity severity,
        BugType type,
        String sprintId,
        List<String> attachments,
        Long expectedVersion
) {}

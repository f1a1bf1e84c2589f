package io.github.drompincen.bugflow.protocol.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AssignBugRequest(
        @NotBlank(message = "Assignee user ID is required") String assignedTo,
        @NotBlank(message = "Assigner user ID is required") String assignedBy,
        @NotNull(message = "User role is required") UserRole userRole,
        Long expectedVersion
) {}

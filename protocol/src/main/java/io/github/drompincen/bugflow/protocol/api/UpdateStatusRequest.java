package io.github.drompincen.bugflow.protocol.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UpdateStatusRequest(
        @NotNull(message = "Status is required") BugStatus status,
        @NotBlank(message = "User ID is required") String userId,
        @NotNull(message = "User role is required") UserRole userRole,
        Long expectedVersion
) {}

package io.github.drompincen.bugflow.protocol.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * One activity record in the old colon-delimited encoding, e.g.
 * {@code status_changed:Resolved}. {@code timestamp} is the original time.
 */
public record ImportLegacyActivityRequest(
        @NotBlank(message = "Bug ID is required") String bugId,
        @NotBlank(message = "Action is required") String action,
        @NotBlank(message = "Author user ID is required") String authorId,
        @NotNull(message = "Timestamp is required") Instant timestamp,
        @NotNull(message = "User role is required") UserRole userRole
) {}

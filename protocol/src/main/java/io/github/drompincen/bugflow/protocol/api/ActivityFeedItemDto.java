package io.github.drompincen.bugflow.protocol.api;

import java.time.Instant;

/**
 * An activity joined with display names for the dashboard feed. {@code newStatus}
 * and {@code assignedToName} are only set for the matching action variants.
 */
public record ActivityFeedItemDto(
        String id,
        String bugId,
        ActivityAction action,
        String authorId,
        Instant timestamp,
        BugStatus newStatus,
        String assignedToName,
        String performedByName,
        String bugTitle,
        String projectId,
        String projectName
) {}

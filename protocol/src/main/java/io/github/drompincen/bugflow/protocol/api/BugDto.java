package io.github.drompincen.bugflow.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public record BugDto(
        String id,
        String title,
        String description,
        String projectId,
        String reportedBy,
        String assignedTo,
        String sprintId,
        BugStatus status,
        BugPriority priority,
        BugSeverity severity,
        BugType type,
        Set<BugTag> tags,
        List<String> attachments,
        boolean validated,
        Long version,
        Instant createdAt,
        Instant updatedAt
) {
    public BugDto withStatus(BugStatus newStatus) {
        return new BugDto(id, title, description, projectId, reportedBy, assignedTo, sprintId,
                newStatus, priority, severity, type, tags, attachments, validated, version,
                createdAt, updatedAt);
    }

    public BugDto withValidated(boolean newValidated) {
        return new BugDto(id, title, description, projectId, reportedBy, assignedTo, sprintId,
                status, priority, severity, type, tags, attachments, newValidated, version,
                createdAt, updatedAt);
    }
}

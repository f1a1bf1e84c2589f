package io.github.drompincen.bugflow.runtime.bug;

import io.github.drompincen.bugflow.persistence.document.BugDocument;
import io.github.drompincen.bugflow.protocol.api.BugDto;

import java.util.List;
import java.util.Set;

public final class BugMapper {

    private BugMapper() {}

    public static BugDto toDto(BugDocument doc) {
        return new BugDto(
                doc.getBugId(),
                doc.getTitle(),
                doc.getDescription(),
                doc.getProjectId(),
                doc.getReportedBy(),
                doc.getAssignedTo(),
                doc.getSprintId(),
                doc.getStatus(),
                doc.getPriority(),
                doc.getSeverity(),
                doc.getType(),
                doc.getTags() != null ? Set.copyOf(doc.getTags()) : Set.of(),
                doc.getAttachments() != null ? List.copyOf(doc.getAttachments()) : List.of(),
                doc.isValidated(),
                doc.getVersion(),
                doc.getCreatedAt(),
                doc.getUpdatedAt());
    }
}

package io.github.drompincen.bugflow.persistence.document;

import io.github.drompincen.bugflow.protocol.api.BugPriority;
import io.github.drompincen.bugflow.protocol.api.BugSeverity;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.protocol.api.BugTag;
import io.github.drompincen.bugflow.protocol.api.BugType;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Authoritative bug record. Saves are compare-and-swap on {@link #version}: a save
 * carrying a stale version fails with
 * {@link org.springframework.dao.OptimisticLockingFailureException}.
 */
@Document(collection = "bugs")
@CompoundIndex(name = "project_status", def = "{'projectId': 1, 'status': 1}")
public class BugDocument {

    @Id
    private String bugId;
    private String title;
    private String description;
    private String projectId;
    private String reportedBy;
    @Indexed
    private String assignedTo;
    private String sprintId;
    private BugStatus status;
    private BugPriority priority;
    private BugSeverity severity;
    private BugType type;
    private Set<BugTag> tags;
    private List<String> attachments;
    private boolean validated;

    @Version
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;

    public BugDocument() {}

    /** Field-by-field copy, used to keep an untouched snapshot around a write. */
    public BugDocument copy() {
        BugDocument c = new BugDocument();
        c.bugId = bugId;
        c.title = title;
        c.description = description;
        c.projectId = projectId;
        c.reportedBy = reportedBy;
        c.assignedTo = assignedTo;
        c.sprintId = sprintId;
        c.status = status;
        c.priority = priority;
        c.severity = severity;
        c.type = type;
        c.tags = tags == null ? null : (tags.isEmpty() ? EnumSet.noneOf(BugTag.class) : EnumSet.copyOf(tags));
        c.attachments = attachments == null ? null : List.copyOf(attachments);
        c.validated = validated;
        c.version = version;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }

    public String getBugId() { return bugId; }
    public void setBugId(String bugId) { this.bugId = bugId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getReportedBy() { return reportedBy; }
    public void setReportedBy(String reportedBy) { this.reportedBy = reportedBy; }

    public String getAssignedTo() { return assignedTo; }
    public void setAssignedTo(String assignedTo) { this.assignedTo = assignedTo; }

    public String getSprintId() { return sprintId; }
    public void setSprintId(String sprintId) { this.sprintId = sprintId; }

    public BugStatus getStatus() { return status; }
    public void setStatus(BugStatus status) { this.status = status; }

    public BugPriority getPriority() { return priority; }
    public void setPriority(BugPriority priority) { this.priority = priority; }

    public BugSeverity getSeverity() { return severity; }
    public void setSeverity(BugSeverity severity) { this.severity = severity; }

    public BugType getType() { return type; }
    public void setType(BugType type) { this.type = type; }

    public Set<BugTag> getTags() { return tags; }
    public void setTags(Set<BugTag> tags) { this.tags = tags; }

    public List<String> getAttachments() { return attachments; }
    public void setAttachments(List<String> attachments) { this.attachments = attachments; }

    public boolean isValidated() { return validated; }
    public void setValidated(boolean validated) { this.validated = validated; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}

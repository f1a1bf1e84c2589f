package io.github.drompincen.bugflow.persistence.document;

import io.github.drompincen.bugflow.protocol.api.ActivityAction;
import io.github.drompincen.bugflow.protocol.api.ActivityActionType;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One audit record. The action is stored decoded: its type plus whichever target
 * field that type uses. Records are inserted once and never updated.
 */
@Document(collection = "activities")
@CompoundIndex(name = "bug_seq", def = "{'bugId': 1, 'seq': 1}", unique = true)
public class ActivityDocument {

    @Id
    private String activityId;
    private String bugId;
    private ActivityActionType action;
    private BugStatus targetStatus;
    private String targetUserId;
    private String authorId;
    private long seq;
    @Indexed
    private Instant timestamp;
    private String legacyAction;

    public ActivityDocument() {}

    public ActivityAction toAction() {
        return ActivityAction.of(action, targetStatus, targetUserId);
    }

    public void applyAction(ActivityAction value) {
        this.action = value.kind();
        this.targetStatus = value instanceof ActivityAction.StatusChanged sc ? sc.to() : null;
        this.targetUserId = value instanceof ActivityAction.Assigned a ? a.to() : null;
    }

    public String getActivityId() { return activityId; }
    public void setActivityId(String activityId) { this.activityId = activityId; }

    public String getBugId() { return bugId; }
    public void setBugId(String bugId) { this.bugId = bugId; }

    public ActivityActionType getAction() { return action; }
    public void setAction(ActivityActionType action) { this.action = action; }

    public BugStatus getTargetStatus() { return targetStatus; }
    public void setTargetStatus(BugStatus targetStatus) { this.targetStatus = targetStatus; }

    public String getTargetUserId() { return targetUserId; }
    public void setTargetUserId(String targetUserId) { this.targetUserId = targetUserId; }

    public String getAuthorId() { return authorId; }
    public void setAuthorId(String authorId) { this.authorId = authorId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    /** Raw encoded action of a migrated record; null for native records. */
    public String getLegacyAction() { return legacyAction; }
    public void setLegacyAction(String legacyAction) { this.legacyAction = legacyAction; }
}

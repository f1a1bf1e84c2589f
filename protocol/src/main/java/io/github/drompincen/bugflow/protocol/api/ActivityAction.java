package io.github.drompincen.bugflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What an activity records. Variants that refer to a target carry it as a typed
 * field, serialized as {@code {"type":"assigned","to":"u-42"}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ActivityAction.Reported.class, name = "reported"),
        @JsonSubTypes.Type(value = ActivityAction.Commented.class, name = "commented"),
        @JsonSubTypes.Type(value = ActivityAction.Validated.class, name = "validated"),
        @JsonSubTypes.Type(value = ActivityAction.StatusChanged.class, name = "status_changed"),
        @JsonSubTypes.Type(value = ActivityAction.Assigned.class, name = "assigned")
})
public sealed interface ActivityAction
        permits ActivityAction.Reported, ActivityAction.Commented, ActivityAction.Validated,
                ActivityAction.StatusChanged, ActivityAction.Assigned {

    @JsonIgnore
    ActivityActionType kind();

    /** True when a variant that needs a target actually has one. */
    @JsonIgnore
    default boolean isComplete() {
        return true;
    }

    record Reported() implements ActivityAction {
        @Override public ActivityActionType kind() { return ActivityActionType.REPORTED; }
    }

    record Commented() implements ActivityAction {
        @Override public ActivityActionType kind() { return ActivityActionType.COMMENTED; }
    }

    record Validated() implements ActivityAction {
        @Override public ActivityActionType kind() { return ActivityActionType.VALIDATED; }
    }

    /**
     * {@code to} is null only for records imported from the old string encoding,
     * which did not always store the new status.
     */
    record StatusChanged(BugStatus to) implements ActivityAction {
        @Override public ActivityActionType kind() { return ActivityActionType.STATUS_CHANGED; }
        @Override public boolean isComplete() { return to != null; }
    }

    record Assigned(String to) implements ActivityAction {
        @Override public ActivityActionType kind() { return ActivityActionType.ASSIGNED; }
        @Override public boolean isComplete() { return to != null && !to.isBlank(); }
    }

    static ActivityAction reported() { return new Reported(); }

    static ActivityAction commented() { return new Commented(); }

    static ActivityAction validated() { return new Validated(); }

    static ActivityAction statusChanged(BugStatus to) { return new StatusChanged(to); }

    static ActivityAction assigned(String userId) { return new Assigned(userId); }

    /**
     * Rebuilds an action from its stored parts. {@code targetStatus} and
     * {@code targetUserId} are only read for the variants that use them.
     */
    static ActivityAction of(ActivityActionType type, BugStatus targetStatus, String targetUserId) {
        return switch (type) {
            case REPORTED -> new Reported();
            case COMMENTED -> new Commented();
            case VALIDATED -> new Validated();
            case STATUS_CHANGED -> new StatusChanged(targetStatus);
            case ASSIGNED -> new Assigned(targetUserId);
        };
    }

    /**
     * Decodes the old colon-delimited action field, e.g. {@code assigned:u-42} or
     * {@code status_changed:In Progress}. Used only when migrating old records.
     */
    static ActivityAction fromLegacy(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalArgumentException("Legacy action must not be blank");
        }
        int colon = encoded.indexOf(':');
        String head = colon < 0 ? encoded : encoded.substring(0, colon);
        String tail = colon < 0 ? null : encoded.substring(colon + 1).trim();
        if (tail != null && tail.isEmpty()) tail = null;

        ActivityActionType type = ActivityActionType.fromCode(head);
        return switch (type) {
            case STATUS_CHANGED -> new StatusChanged(tail != null ? BugStatus.fromLabel(tail) : null);
            case ASSIGNED -> new Assigned(tail);
            default -> of(type, null, null);
        };
    }
}

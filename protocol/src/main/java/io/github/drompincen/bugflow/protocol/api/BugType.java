package io.github.drompincen.bugflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What kind of work item a bug record represents.
 */
public enum BugType {
    BUG("bug"),
    EPIC("epic"),
    TASK("task"),
    SUGGESTION("suggestion");

    private final String label;

    BugType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static BugType fromLabel(String value) {
        if (value != null) {
            for (BugType t : values()) {
                if (t.label.equalsIgnoreCase(value.trim())) return t;
            }
        }
        throw new IllegalArgumentException(
                "Invalid bug type '" + value + "'. Must be bug, epic, task, or suggestion");
    }
}

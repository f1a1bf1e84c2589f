package io.github.drompincen.bugflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed bug lifecycle. The wire form is the human label ({@code "In Progress"}),
 * the enum name is what gets stored.
 */
public enum BugStatus {
    OPEN("Open"),
    IN_PROGRESS("In Progress"),
    RESOLVED("Resolved"),
    CLOSED("Closed");

    private final String label;

    BugStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Accepts either the label or the constant name, ignoring case. */
    @JsonCreator
    public static BugStatus fromLabel(String value) {
        if (value != null) {
            String v = value.trim();
            for (BugStatus s : values()) {
                if (s.label.equalsIgnoreCase(v) || s.name().equalsIgnoreCase(v)) return s;
            }
        }
        throw new IllegalArgumentException(
                "Invalid bug status '" + value + "'. Must be Open, In Progress, Resolved, or Closed");
    }
}

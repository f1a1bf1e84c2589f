package io.github.drompincen.bugflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BugSeverity {
    MINOR("Minor"),
    MAJOR("Major"),
    BLOCKER("Blocker");

    private final String label;

    BugSeverity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static BugSeverity fromLabel(String value) {
        if (value != null) {
            for (BugSeverity s : values()) {
                if (s.label.equalsIgnoreCase(value.trim()) || s.name().equalsIgnoreCase(value.trim())) return s;
            }
        }
        throw new IllegalArgumentException(
                "Invalid bug severity '" + value + "'. Must be Minor, Major, or Blocker");
    }
}

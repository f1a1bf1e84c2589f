package io.github.drompincen.bugflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BugPriority {
    LOWEST("Lowest"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    HIGHEST("Highest");

    private final String label;

    BugPriority(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static BugPriority fromLabel(String value) {
        if (value != null) {
            for (BugPriority p : values()) {
                if (p.label.equalsIgnoreCase(value.trim()) || p.name().equalsIgnoreCase(value.trim())) return p;
            }
        }
        throw new IllegalArgumentException(
                "Invalid bug priority '" + value + "'. Must be Lowest, Low, Medium, High, or Highest");
    }
}

package io.github.drompincen.bugflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Predefined labels. A bug may carry any number of them.
 */
public enum BugTag {
    EPIC("Epic"),
    TASK("Task"),
    SUGGESTION("Suggestion"),
    BUG_FRONTEND("Bug:Frontend"),
    BUG_BACKEND("Bug:Backend"),
    BUG_TEST("Bug:Test"),
    UI("UI"),
    MOBILE("Mobile"),
    BACKEND("Backend"),
    PAYMENT("Payment"),
    BROWSER("Browser"),
    PERFORMANCE("Performance"),
    DATABASE("Database");

    private final String label;

    BugTag(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static BugTag fromLabel(String value) {
        if (value != null) {
            for (BugTag t : values()) {
                if (t.label.equalsIgnoreCase(value.trim()) || t.name().equalsIgnoreCase(value.trim())) return t;
            }
        }
        throw new IllegalArgumentException("Invalid bug tag '" + value + "'");
    }
}

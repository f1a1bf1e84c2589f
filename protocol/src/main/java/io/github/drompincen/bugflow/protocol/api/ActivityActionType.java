package io.github.drompincen.bugflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator of {@link ActivityAction}. The code is the externally observable
 * action name.
 */
public enum ActivityActionType {
    REPORTED("reported"),
    ASSIGNED("assigned"),
    STATUS_CHANGED("status_changed"),
    COMMENTED("commented"),
    VALIDATED("validated");

    private final String code;

    ActivityActionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ActivityActionType fromCode(String code) {
        if (code != null) {
            for (ActivityActionType t : values()) {
                if (t.code.equalsIgnoreCase(code.trim())) return t;
            }
        }
        throw new IllegalArgumentException("Unknown activity action '" + code + "'");
    }
}

package io.github.drompincen.bugflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Actor roles. Each role maps to a fixed {@link RolePermissions} entry; there is
 * no per-user configuration.
 */
public enum UserRole {
    TESTER("tester", new RolePermissions(true, true, true, false, false, true)),
    DEVELOPER("developer", new RolePermissions(true, false, false, true, true, true)),
    ADMIN("admin", new RolePermissions(true, true, true, true, true, true));

    private final String label;
    private final RolePermissions permissions;

    UserRole(String label, RolePermissions permissions) {
        this.label = label;
        this.permissions = permissions;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public RolePermissions permissions() {
        return permissions;
    }

    @JsonCreator
    public static UserRole fromLabel(String value) {
        if (value != null) {
            for (UserRole r : values()) {
                if (r.label.equalsIgnoreCase(value.trim())) return r;
            }
        }
        throw new IllegalArgumentException(
                "Invalid user role '" + value + "'. Must be admin, developer, or tester");
    }
}

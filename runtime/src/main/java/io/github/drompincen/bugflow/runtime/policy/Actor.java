package io.github.drompincen.bugflow.runtime.policy;

import io.github.drompincen.bugflow.protocol.api.UserRole;

/**
 * Who is performing an operation. Passed explicitly into every lifecycle call.
 */
public record Actor(String id, UserRole role) {

    public static Actor of(String id, UserRole role) {
        return new Actor(id, role);
    }
}

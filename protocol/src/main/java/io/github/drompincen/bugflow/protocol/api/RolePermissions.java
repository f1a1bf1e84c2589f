package io.github.drompincen.bugflow.protocol.api;

public record RolePermissions(
        boolean canCreateBug,
        boolean canValidateBug,
        boolean canCloseBug,
        boolean canAssignBug,
        boolean canUpdateStatus,
        boolean canComment
) {}

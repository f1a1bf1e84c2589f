package io.github.drompincen.bugflow.runtime.policy;

import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.protocol.api.RolePermissions;
import io.github.drompincen.bugflow.protocol.api.UserRole;
import org.springframework.stereotype.Component;

/**
 * Pure decision functions for the guarded lifecycle transitions. No state, no I/O:
 * the same inputs always give the same {@link Decision}. A null role has no
 * permissions.
 */
@Component
public class AuthorizationPolicy {

    private static final RolePermissions NONE = new RolePermissions(false, false, false, false, false, false);

    public Decision checkStatusChange(BugStatus currentStatus, BugStatus requestedStatus, UserRole role) {
        if (currentStatus == BugStatus.CLOSED && role != UserRole.ADMIN) {
            return Decision.deny(DenialReason.ONLY_ADMIN_MAY_MODIFY_CLOSED);
        }
        if (requestedStatus == BugStatus.CLOSED) {
            return checkClose(role);
        }
        return Decision.allow();
    }

    public Decision checkClose(UserRole role) {
        return permissions(role).canCloseBug()
                ? Decision.allow()
                : Decision.deny(DenialReason.ONLY_TESTER_OR_ADMIN_MAY_CLOSE);
    }

    public Decision checkValidate(UserRole role) {
        return permissions(role).canValidateBug()
                ? Decision.allow()
                : Decision.deny(DenialReason.INSUFFICIENT_PERMISSIONS, "Only Testers and Admins can validate bugs");
    }

    public Decision checkAssign(UserRole role) {
        return permissions(role).canAssignBug()
                ? Decision.allow()
                : Decision.deny(DenialReason.INSUFFICIENT_PERMISSIONS, "Only Developers and Admins can assign bugs");
    }

    public Decision checkCreate(UserRole role) {
        return permissions(role).canCreateBug()
                ? Decision.allow()
                : Decision.deny(DenialReason.INSUFFICIENT_PERMISSIONS, "Role is not allowed to report bugs");
    }

    public Decision checkComment(UserRole role) {
        return permissions(role).canComment()
                ? Decision.allow()
                : Decision.deny(DenialReason.INSUFFICIENT_PERMISSIONS, "Role is not allowed to comment");
    }

    /** Migrating old activity records is an admin task. */
    public Decision checkImport(UserRole role) {
        return role == UserRole.ADMIN
                ? Decision.allow()
                : Decision.deny(DenialReason.INSUFFICIENT_PERMISSIONS, "Only Admins can import legacy activity");
    }

    private static RolePermissions permissions(UserRole role) {
        return role == null ? NONE : role.permissions();
    }
}

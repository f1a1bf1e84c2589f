package io.github.drompincen.bugflow.runtime.policy;

public enum DenialReason {
    ONLY_ADMIN_MAY_MODIFY_CLOSED("OnlyAdminMayModifyClosed", "Only Admins can modify closed bugs"),
    ONLY_TESTER_OR_ADMIN_MAY_CLOSE("OnlyTesterOrAdminMayClose", "Only Testers and Admins can close bugs"),
    INSUFFICIENT_PERMISSIONS("InsufficientPermissions", "Insufficient permissions");

    private final String code;
    private final String defaultMessage;

    DenialReason(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String code() { return code; }

    public String defaultMessage() { return defaultMessage; }
}

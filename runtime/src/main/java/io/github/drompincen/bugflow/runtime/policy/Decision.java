package io.github.drompincen.bugflow.runtime.policy;

/**
 * Outcome of a policy check. {@code reason} and {@code message} are null when allowed.
 */
public record Decision(boolean allowed, DenialReason reason, String message) {

    private static final Decision ALLOWED = new Decision(true, null, null);

    public static Decision allow() {
        return ALLOWED;
    }

    public static Decision deny(DenialReason reason) {
        return new Decision(false, reason, reason.defaultMessage());
    }

    public static Decision deny(DenialReason reason, String message) {
        return new Decision(false, reason, message);
    }

    public boolean denied() {
        return !allowed;
    }
}

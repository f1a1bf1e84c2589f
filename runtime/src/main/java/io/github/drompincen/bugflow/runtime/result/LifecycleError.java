package io.github.drompincen.bugflow.runtime.result;

import io.github.drompincen.bugflow.runtime.policy.Decision;

/**
 * A rejected operation. {@code code} is a stable machine-readable tag
 * ({@code OnlyAdminMayModifyClosed}, {@code MustBeResolved}, ...), {@code message}
 * is for people.
 */
public record LifecycleError(ErrorKind kind, String code, String message) {

    public static final String MUST_BE_RESOLVED = "MustBeResolved";

    public static LifecycleError notFound(String entity, String id) {
        return new LifecycleError(ErrorKind.NOT_FOUND, entity.replace(" ", "") + "NotFound",
                "%s with ID %s does not exist".formatted(entity, id));
    }

    public static LifecycleError assigneeNotFound() {
        return new LifecycleError(ErrorKind.NOT_FOUND, "AssigneeNotFound", "Assignee user not found");
    }

    public static LifecycleError forbidden(Decision decision) {
        return new LifecycleError(ErrorKind.FORBIDDEN, decision.reason().code(), decision.message());
    }

    public static LifecycleError invalidState(String code, String message) {
        return new LifecycleError(ErrorKind.INVALID_STATE, code, message);
    }

    public static LifecycleError validationFailed(String message) {
        return new LifecycleError(ErrorKind.VALIDATION_FAILED, "ValidationFailed", message);
    }

    public static LifecycleError conflict(String message) {
        return new LifecycleError(ErrorKind.CONFLICT, "Conflict", message);
    }

    public static LifecycleError infrastructure(String message) {
        return new LifecycleError(ErrorKind.INFRASTRUCTURE, "Infrastructure", message);
    }
}

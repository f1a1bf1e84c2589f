package io.github.drompincen.bugflow.runtime.result;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either the value of an accepted operation or the {@link LifecycleError} that
 * rejected it. Domain rule violations travel as values of this type, never as
 * exceptions.
 */
public final class LifecycleResult<T> {

    private final T value;
    private final LifecycleError error;

    private LifecycleResult(T value, LifecycleError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> LifecycleResult<T> success(T value) {
        return new LifecycleResult<>(value, null);
    }

    public static <T> LifecycleResult<T> failure(LifecycleError error) {
        return new LifecycleResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value on failed result: " + error);
        }
        return value;
    }

    public LifecycleError getError() {
        return error;
    }

    public <R> LifecycleResult<R> map(Function<? super T, ? extends R> mapper) {
        return error == null ? success(mapper.apply(value)) : failure(error);
    }

    /** Re-types a failure; only valid on failed results. */
    public <R> LifecycleResult<R> propagate() {
        if (error == null) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return failure(error);
    }

    @Override
    public String toString() {
        return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}

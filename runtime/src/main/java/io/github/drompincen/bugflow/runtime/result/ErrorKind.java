package io.github.drompincen.bugflow.runtime.result;

public enum ErrorKind {
    NOT_FOUND,
    FORBIDDEN,
    INVALID_STATE,
    VALIDATION_FAILED,
    CONFLICT,
    INFRASTRUCTURE
}

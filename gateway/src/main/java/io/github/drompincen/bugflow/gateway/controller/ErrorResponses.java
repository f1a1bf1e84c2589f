package io.github.drompincen.bugflow.gateway.controller;

import io.github.drompincen.bugflow.protocol.api.ErrorResponse;
import io.github.drompincen.bugflow.runtime.result.ErrorKind;
import io.github.drompincen.bugflow.runtime.result.LifecycleError;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps rejected lifecycle results onto HTTP.
 */
final class ErrorResponses {

    private ErrorResponses() {}

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case INVALID_STATE, VALIDATION_FAILED -> HttpStatus.BAD_REQUEST;
            case CONFLICT -> HttpStatus.CONFLICT;
            case INFRASTRUCTURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    static String titleOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> "Not found";
            case FORBIDDEN -> "Forbidden";
            case INVALID_STATE -> "Invalid state";
            case VALIDATION_FAILED -> "Validation failed";
            case CONFLICT -> "Conflict";
            case INFRASTRUCTURE -> "Internal server error";
        };
    }

    static ResponseEntity<Object> of(LifecycleError error) {
        return ResponseEntity.status(statusOf(error.kind()))
                .body(new ErrorResponse(titleOf(error.kind()), error.message(), error.code()));
    }
}

package com.userservice.exception;

import org.springframework.http.HttpStatus;

/**
 * The fixed set of error kinds visible to API callers.
 * Each kind owns the HTTP status it is rendered with.
 */
public enum ErrorKind {

    NOT_FOUND(HttpStatus.NOT_FOUND),
    VALIDATION(HttpStatus.BAD_REQUEST),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    CONFLICT(HttpStatus.CONFLICT),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR),
    DATABASE(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /**
     * Whether the underlying cause must stay out of the response body.
     */
    public boolean isRedacted() {
        return this == INTERNAL || this == DATABASE;
    }
}

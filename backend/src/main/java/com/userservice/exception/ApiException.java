package com.userservice.exception;

/**
 * Base class of every failure that reaches the API boundary.
 * There is exactly one subclass per {@link ErrorKind}.
 */
public abstract class ApiException extends RuntimeException {

    static final String REDACTED_MESSAGE = "internal error";

    private final ErrorKind kind;

    protected ApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ApiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Message rendered to the caller. Redacted kinds never expose their cause.
     */
    public String getPublicMessage() {
        return kind.isRedacted() ? REDACTED_MESSAGE : getMessage();
    }
}

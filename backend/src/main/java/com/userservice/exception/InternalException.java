package com.userservice.exception;

/**
 * Wraps an unexpected failure. The cause is logged, never sent to the caller.
 */
public class InternalException extends ApiException {

    public InternalException(Throwable cause) {
        super(ErrorKind.INTERNAL, REDACTED_MESSAGE, cause);
    }
}

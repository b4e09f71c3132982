package com.userservice.exception;

/**
 * Exception thrown when a write would break a uniqueness rule.
 */
public class ConflictException extends ApiException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}

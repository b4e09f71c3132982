package com.userservice.exception;

/**
 * Exception thrown when a request is malformed or fails input validation.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}

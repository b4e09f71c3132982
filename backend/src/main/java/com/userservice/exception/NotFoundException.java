package com.userservice.exception;

/**
 * Exception thrown when a requested resource does not exist.
 * The message is the resource name, e.g. "user".
 */
public class NotFoundException extends ApiException {

    private final String resource;

    public NotFoundException(String resource) {
        super(ErrorKind.NOT_FOUND, resource);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}

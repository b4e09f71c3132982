package com.userservice.exception;

public class ForbiddenException extends ApiException {

    public ForbiddenException() {
        super(ErrorKind.FORBIDDEN, "forbidden");
    }
}

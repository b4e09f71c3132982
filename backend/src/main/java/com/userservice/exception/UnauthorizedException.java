package com.userservice.exception;

public class UnauthorizedException extends ApiException {

    public UnauthorizedException() {
        super(ErrorKind.UNAUTHORIZED, "unauthorized");
    }
}

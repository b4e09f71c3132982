package com.userservice.exception;

/**
 * Wraps a storage-layer fault (connectivity, pool exhaustion, unexpected
 * constraint violation). The cause is logged, never sent to the caller.
 */
public class DatabaseException extends ApiException {

    public DatabaseException(Throwable cause) {
        super(ErrorKind.DATABASE, REDACTED_MESSAGE, cause);
    }
}

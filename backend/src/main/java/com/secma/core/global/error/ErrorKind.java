package com.secma.core.global.error;

/**
 * Failure categories surfaced to the transport collaborator, with the HTTP status it is expected to
 * answer with.
 */
public enum ErrorKind {

    INVALID_CREDENTIALS(401),
    TOKEN_INVALID(401),
    PERMISSION_DENIED(403),
    NOT_FOUND(404),
    CONFLICT(409),
    INVALID_INPUT(422),
    STORE_UNAVAILABLE(503);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}

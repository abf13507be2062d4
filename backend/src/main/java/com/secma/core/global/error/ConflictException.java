package com.secma.core.global.error;

public class ConflictException extends SecmaException {

    public ConflictException(String code, String detail) {
        super(ErrorKind.CONFLICT, code, detail);
    }

    public ConflictException(String code, String detail, Throwable cause) {
        super(ErrorKind.CONFLICT, code, detail, cause);
    }
}

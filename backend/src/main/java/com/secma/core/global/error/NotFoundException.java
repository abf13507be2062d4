package com.secma.core.global.error;

public class NotFoundException extends SecmaException {

    public NotFoundException(String code, String detail) {
        super(ErrorKind.NOT_FOUND, code, detail);
    }
}

package com.secma.core.global.error;

public class InvalidInputException extends SecmaException {

    private final String field;

    public InvalidInputException(String field, String detail) {
        super(ErrorKind.INVALID_INPUT, "invalid-" + field, detail);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

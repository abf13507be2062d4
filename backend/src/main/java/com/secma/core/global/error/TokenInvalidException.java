package com.secma.core.global.error;

public class TokenInvalidException extends SecmaException {

    public static final String CODE = "token-invalid";

    public TokenInvalidException(String detail) {
        super(ErrorKind.TOKEN_INVALID, CODE, detail);
    }

    public TokenInvalidException(String detail, Throwable cause) {
        super(ErrorKind.TOKEN_INVALID, CODE, detail, cause);
    }
}

package com.secma.core.global.error;

/**
 * Login failure. The detail is identical for every cause apart from the trace id, which is also
 * written to the log so operators can find the real reason.
 */
public class InvalidCredentialsException extends SecmaException {

    public static final String CODE = "invalid-credentials";

    private final String traceId;

    public InvalidCredentialsException(String traceId) {
        super(ErrorKind.INVALID_CREDENTIALS, CODE,
                "Could not validate credentials (trace ID: " + traceId + ").");
        this.traceId = traceId;
    }

    public String getTraceId() {
        return traceId;
    }
}

package com.secma.core.global.error;

import java.util.Locale;

/**
 * Base of every typed failure raised by the core. Carries a stable machine-readable code, a human
 * detail and a problem type URN the transport can copy into a problem+json body.
 */
public abstract class SecmaException extends RuntimeException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:secma:";

    private final ErrorKind kind;
    private final String code;
    private final String detail;
    private final String type;

    protected SecmaException(ErrorKind kind, String code, String detail) {
        this(kind, code, detail, null);
    }

    protected SecmaException(ErrorKind kind, String code, String detail, Throwable cause) {
        super(code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("SecmaException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }

    @Override
    public String getMessage() {
        return code + ": " + detail;
    }
}

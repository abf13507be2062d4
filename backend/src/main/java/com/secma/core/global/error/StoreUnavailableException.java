package com.secma.core.global.error;

/**
 * Transient persistence failure. The core never retries on its own; callers may retry after
 * {@link #getRetryAfterSeconds()}.
 */
public class StoreUnavailableException extends SecmaException {

    public static final String CODE = "store-unavailable";
    public static final int DEFAULT_RETRY_AFTER_SECONDS = 1;

    private final int retryAfterSeconds;

    public StoreUnavailableException(String detail, Throwable cause) {
        this(detail, DEFAULT_RETRY_AFTER_SECONDS, cause);
    }

    public StoreUnavailableException(String detail, int retryAfterSeconds, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, CODE, detail, cause);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

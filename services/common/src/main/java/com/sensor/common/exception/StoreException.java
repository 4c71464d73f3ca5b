package com.sensor.common.exception;

/**
 * A store operation failed. {@link #isRetryable()} tells callers whether repeating the
 * same operation later can succeed.
 */
public class StoreException extends RuntimeException {

    private final boolean retryable;

    public StoreException(String message, Throwable cause) {
        this(message, cause, false);
    }

    protected StoreException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

package com.backend.artscan.exception;

/**
 * Base of the pipeline's failure taxonomy. {@code retryable} tells the caller that resubmitting the same
 * request may succeed.
 */
public abstract class ArtScanException extends RuntimeException {

    private final boolean retryable;

    protected ArtScanException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    protected ArtScanException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

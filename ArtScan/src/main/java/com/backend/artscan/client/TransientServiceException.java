package com.backend.artscan.client;

/**
 * Transport-level failure of an external model call: connection refused, timeout or a 5xx answer.
 */
public class TransientServiceException extends RuntimeException {

    public TransientServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}

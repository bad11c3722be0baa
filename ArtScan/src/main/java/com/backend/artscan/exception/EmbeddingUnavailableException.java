package com.backend.artscan.exception;

public class EmbeddingUnavailableException extends ArtScanException {

    public EmbeddingUnavailableException(String message) {
        super(message, true);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause, true);
    }
}

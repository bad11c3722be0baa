package com.backend.artscan.exception;

/**
 * The upload is empty, not an image, or cannot be decoded. Raised before any embedding call.
 */
public class InvalidImageException extends ArtScanException {

    public InvalidImageException(String message) {
        super(message, false);
    }
}

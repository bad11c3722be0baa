package com.backend.artscan.exception;

/**
 * A concurrent writer won a store-level uniqueness race: another node holds the catalog lease for the same
 * embedding bucket, or took the same scan timestamp for a user until retries ran out.
 */
public class StoreConflictException extends ArtScanException {

    public StoreConflictException(String message, Throwable cause) {
        super(message, cause, true);
    }
}

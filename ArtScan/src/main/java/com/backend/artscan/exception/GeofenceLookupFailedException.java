package com.backend.artscan.exception;

/**
 * The museum lookup failed. Callers fall back to an empty scope; this never fails a scan.
 */
public class GeofenceLookupFailedException extends ArtScanException {

    public GeofenceLookupFailedException(String message, Throwable cause) {
        super(message, cause, true);
    }
}

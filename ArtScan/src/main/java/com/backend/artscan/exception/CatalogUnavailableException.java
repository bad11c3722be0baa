package com.backend.artscan.exception;

/**
 * The catalog could not settle a concurrent insert in time. The scan may be resubmitted.
 */
public class CatalogUnavailableException extends ArtScanException {

    public CatalogUnavailableException(String message) {
        super(message, true);
    }
}

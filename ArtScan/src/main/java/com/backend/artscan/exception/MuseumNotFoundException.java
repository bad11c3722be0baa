package com.backend.artscan.exception;

public class MuseumNotFoundException extends ArtScanException {

    public MuseumNotFoundException(Long museumId) {
        super("Museum not found: " + museumId, false);
    }
}

package com.backend.artscan.exception;

public class ArtworkNotFoundException extends ArtScanException {

    public ArtworkNotFoundException(Long artworkId) {
        super("Artwork not found: " + artworkId, false);
    }
}

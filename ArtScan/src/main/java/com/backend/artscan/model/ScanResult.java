package com.backend.artscan.model;

import lombok.Builder;
import lombok.Value;

/**
 * The single terminal outcome of a scan.
 */
@Value
@Builder
public class ScanResult {
    ScanStatus status;
    Artwork artwork;
    /** Cosine distance to the returned artwork, when there is one. */
    Double distance;
    ArtworkAnalysis analysis;
    String message;
    boolean cataloged;
    Long scanId;
}

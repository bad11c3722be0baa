package com.backend.artscan.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Verdict of the generative vision service for an unrecognised image.
 */
@Value
@Builder
public class ArtworkAnalysis {
    boolean artwork;
    String label;
    String artist;
    String description;
    @Singular("detail")
    Map<String, Object> details;
    Double confidence;
}

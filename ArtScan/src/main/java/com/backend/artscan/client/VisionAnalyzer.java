package com.backend.artscan.client;

import com.backend.artscan.model.ArtworkAnalysis;

/**
 * Generative description capability for images the catalog does not recognise.
 */
public interface VisionAnalyzer {

    ArtworkAnalysis analyze(byte[] image, String contentType);
}

package com.backend.artscan.service;

import com.backend.artscan.client.VisionAnalyzer;
import com.backend.artscan.exception.AnalysisUnavailableException;
import com.backend.artscan.model.ArtworkAnalysis;
import com.backend.artscan.model.CatalogOutcome;
import com.backend.artscan.model.CatalogRequest;
import com.backend.artscan.model.GeofenceScope;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the generative analysis for unrecognised images and hands artworks to the catalog.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FallbackAnalysisService {

    private final VisionAnalyzer visionAnalyzer;
    private final AutoCatalogService autoCatalogService;

    /**
     * Analyses the image and, when it is an artwork, catalogues it.
     */
    public FallbackResult dispatch(byte[] image, String contentType, float[] embedding, GeofenceScope scope,
                                   String imageUrl) {
        ArtworkAnalysis analysis = analyze(image, contentType);
        if (!analysis.isArtwork()) {
            log.info("Analysis classified the image as not an artwork");
            return new FallbackResult(analysis, null);
        }

        CatalogRequest request = CatalogRequest.builder()
                .embedding(embedding)
                .title(analysis.getLabel())
                .artist(analysis.getArtist())
                .description(describe(analysis))
                .confidence(analysis.getConfidence())
                .scope(scope)
                .imageUrl(imageUrl)
                .build();
        return new FallbackResult(analysis, autoCatalogService.getOrCreate(request));
    }

    public ArtworkAnalysis analyze(byte[] image, String contentType) {
        ArtworkAnalysis analysis;
        try {
            analysis = visionAnalyzer.analyze(image, contentType);
        } catch (AnalysisUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AnalysisUnavailableException("Analysis failed: " + e.getMessage(), e);
        }
        if (analysis == null) {
            throw new AnalysisUnavailableException("Analysis service returned no verdict");
        }
        Double confidence = analysis.getConfidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new AnalysisUnavailableException("Analysis confidence out of range: " + confidence);
        }
        return analysis;
    }

    private static Map<String, Object> describe(ArtworkAnalysis analysis) {
        Map<String, Object> description = new LinkedHashMap<>();
        if (analysis.getDescription() != null) {
            description.put("description", analysis.getDescription());
        }
        description.putAll(analysis.getDetails());
        description.put("ai_generated", true);
        return description;
    }

    @Value
    public static class FallbackResult {
        ArtworkAnalysis analysis;
        /** Null when the image is not an artwork. */
        CatalogOutcome catalogOutcome;

        public boolean isNotArt() {
            return catalogOutcome == null;
        }
    }
}

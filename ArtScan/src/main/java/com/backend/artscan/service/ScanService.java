package com.backend.artscan.service;

import com.backend.artscan.client.ImageStore;
import com.backend.artscan.config.ArtScanProperties;
import com.backend.artscan.exception.ScanCancelledException;
import com.backend.artscan.model.Artwork;
import com.backend.artscan.model.ArtworkAnalysis;
import com.backend.artscan.model.CatalogOutcome;
import com.backend.artscan.model.GeofenceScope;
import com.backend.artscan.model.MatchResult;
import com.backend.artscan.model.ScanEvent;
import com.backend.artscan.model.ScanResult;
import com.backend.artscan.model.ScanStatus;
import com.backend.artscan.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Optional;

/**
 * Runs one scan: embed, geofence, match, and on a miss analyse and catalogue. Every completed scan is
 * recorded in the ledger.
 */
@Slf4j
@Service
public class ScanService {

    static final String ANONYMOUS = "anonymous";
    static final String NOT_ART_MESSAGE = "This does not appear to be an artwork.";

    private final ImageValidator imageValidator;
    private final EmbeddingGateway embeddingGateway;
    private final GeofenceService geofenceService;
    private final VectorMatchService vectorMatchService;
    private final FallbackAnalysisService fallbackAnalysisService;
    private final ScanLedgerService scanLedgerService;
    private final ImageStore imageStore;
    private final boolean legacyStatus;

    public ScanService(ImageValidator imageValidator,
                       EmbeddingGateway embeddingGateway,
                       GeofenceService geofenceService,
                       VectorMatchService vectorMatchService,
                       FallbackAnalysisService fallbackAnalysisService,
                       ScanLedgerService scanLedgerService,
                       ImageStore imageStore,
                       ArtScanProperties properties) {
        this.imageValidator = imageValidator;
        this.embeddingGateway = embeddingGateway;
        this.geofenceService = geofenceService;
        this.vectorMatchService = vectorMatchService;
        this.fallbackAnalysisService = fallbackAnalysisService;
        this.scanLedgerService = scanLedgerService;
        this.imageStore = imageStore;
        this.legacyStatus = properties.getMatch().isLegacyStatus();
    }

    public ScanResult submitScan(byte[] image, String contentType, String filename,
                                 double latitude, double longitude, String userId) {
        imageValidator.validate(image, contentType);
        validateCoordinates(latitude, longitude);
        String user = StringUtils.hasText(userId) ? userId.trim() : ANONYMOUS;

        checkCancelled("embedding");
        float[] embedding = embeddingGateway.embed(image, contentType);

        checkCancelled("geofence lookup");
        GeofenceScope scope = geofenceService.candidateMuseums(latitude, longitude);

        checkCancelled("matching");
        Optional<MatchResult> match = vectorMatchService.match(embedding, scope);
        String imageUrl = storeImage(image, contentType, filename);

        if (match.isPresent()) {
            MatchResult result = match.get();
            ScanStatus status = ScanStatus.forTier(result.getTier(), legacyStatus);
            ScanEvent event = scanLedgerService.record(user, result.getArtwork().getId(), imageUrl, status);
            log.info("Scan by {} matched artwork {} ({}, distance {})", user, result.getArtwork().getId(),
                    result.getTier().getValue(), String.format("%.4f", result.getDistance()));
            return ScanResult.builder()
                    .status(status)
                    .artwork(result.getArtwork())
                    .distance(result.getDistance())
                    .cataloged(false)
                    .scanId(event.getScanId())
                    .build();
        }

        checkCancelled("analysis");
        FallbackAnalysisService.FallbackResult fallback =
                fallbackAnalysisService.dispatch(image, contentType, embedding, scope, imageUrl);
        ArtworkAnalysis analysis = fallback.getAnalysis();

        if (fallback.isNotArt()) {
            ScanEvent event = scanLedgerService.record(user, null, imageUrl, ScanStatus.NOT_ART);
            return ScanResult.builder()
                    .status(ScanStatus.NOT_ART)
                    .analysis(analysis)
                    .message(StringUtils.hasText(analysis.getDescription()) ? analysis.getDescription() : NOT_ART_MESSAGE)
                    .cataloged(false)
                    .scanId(event.getScanId())
                    .build();
        }

        CatalogOutcome outcome = fallback.getCatalogOutcome();
        Artwork artwork = outcome.getArtwork();
        ScanStatus status = outcome.isCreated()
                ? ScanStatus.AI_ANALYSIS
                : ScanStatus.forTier(artwork.tier(), legacyStatus);
        ScanEvent event = scanLedgerService.record(user, artwork.getId(), imageUrl, status);
        return ScanResult.builder()
                .status(status)
                .artwork(artwork)
                .distance(VectorMath.cosineDistance(embedding, artwork.getEmbedding()))
                .analysis(analysis)
                .cataloged(outcome.isCreated())
                .scanId(event.getScanId())
                .build();
    }

    private String storeImage(byte[] image, String contentType, String filename) {
        try {
            return imageStore.store(image, contentType, filename);
        } catch (IOException e) {
            log.warn("Could not store scan image, continuing without a URL: {}", e.getMessage());
            return null;
        }
    }

    private static void validateCoordinates(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90]");
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Longitude must be within [-180, 180]");
        }
    }

    private static void checkCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ScanCancelledException(stage);
        }
    }
}

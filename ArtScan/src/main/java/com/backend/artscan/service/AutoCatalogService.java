package com.backend.artscan.service;

import com.backend.artscan.config.ArtScanProperties;
import com.backend.artscan.exception.CatalogUnavailableException;
import com.backend.artscan.exception.ScanCancelledException;
import com.backend.artscan.exception.StoreConflictException;
import com.backend.artscan.model.Artwork;
import com.backend.artscan.model.ArtworkSource;
import com.backend.artscan.model.CatalogOutcome;
import com.backend.artscan.model.CatalogRequest;
import com.backend.artscan.model.MatchResult;
import com.backend.artscan.model.Museum;
import com.backend.artscan.repository.ArtworkRepository;
import com.backend.artscan.repository.MuseumRepository;
import com.backend.artscan.util.DescriptionJson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Creates catalog entries for artworks seen for the first time, at most once per subject.
 *
 * <p>Concurrent first scans of the same piece are serialised twice over: an in-process claim keyed by
 * embedding proximity, and a lease row in the store keyed by a coarse bucket for other nodes. Inside the
 * guard the match query is re-run before inserting, so a loser returns the winner's row.
 */
@Slf4j
@Service
public class AutoCatalogService {

    private final VectorMatchService vectorMatchService;
    private final InFlightCatalogRegistry registry;
    private final CatalogLeaseService leaseService;
    private final ArtworkRepository artworkRepository;
    private final MuseumRepository museumRepository;
    private final DescriptionJson descriptionJson;
    private final TransactionTemplate transactionTemplate;
    private final ArtScanProperties properties;

    public AutoCatalogService(VectorMatchService vectorMatchService,
                              InFlightCatalogRegistry registry,
                              CatalogLeaseService leaseService,
                              ArtworkRepository artworkRepository,
                              MuseumRepository museumRepository,
                              DescriptionJson descriptionJson,
                              PlatformTransactionManager transactionManager,
                              ArtScanProperties properties) {
        this.vectorMatchService = vectorMatchService;
        this.registry = registry;
        this.leaseService = leaseService;
        this.artworkRepository = artworkRepository;
        this.museumRepository = museumRepository;
        this.descriptionJson = descriptionJson;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.properties = properties;
    }

    public CatalogOutcome getOrCreate(CatalogRequest request) {
        validate(request);
        double threshold = properties.getMatch().getDistanceThreshold();

        while (true) {
            InFlightCatalogRegistry.Claim claim = registry.claim(request.getEmbedding(), threshold);
            if (!claim.isOwner()) {
                awaitCompetitor(claim);
                continue;
            }
            try {
                return createIfAbsent(request);
            } finally {
                registry.release(claim);
            }
        }
    }

    private CatalogOutcome createIfAbsent(CatalogRequest request) {
        Optional<CatalogOutcome> existing = findExisting(request);
        if (existing.isPresent()) {
            return existing.get();
        }

        String bucket = leaseService.bucketOf(request.getEmbedding());
        int attempts = properties.getCatalog().getConflictAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                leaseService.acquire(bucket);
            } catch (StoreConflictException e) {
                log.warn("Catalog insert conflict on bucket {} (attempt {}/{}), re-querying", bucket, attempt, attempts);
                backOff();
                existing = findExisting(request);
                if (existing.isPresent()) {
                    return existing.get();
                }
                continue;
            }
            try {
                // another node may have committed between the first check and the lease
                existing = findExisting(request);
                if (existing.isPresent()) {
                    return existing.get();
                }
                if (Thread.currentThread().isInterrupted()) {
                    throw new ScanCancelledException("catalog insert");
                }
                Artwork created = transactionTemplate.execute(status -> insert(request));
                log.info("Catalogued new artwork {} '{}' (confidence {})",
                        created.getId(), created.getTitle(), created.getConfidenceScore());
                return new CatalogOutcome(created, true);
            } finally {
                leaseService.release(bucket);
            }
        }
        throw new CatalogUnavailableException("Catalog bucket " + bucket + " stayed locked after " + attempts + " attempts");
    }

    private Optional<CatalogOutcome> findExisting(CatalogRequest request) {
        Optional<MatchResult> match = vectorMatchService.match(request.getEmbedding(), request.getScope());
        match.ifPresent(m -> log.info("Artwork {} was catalogued concurrently, reusing it", m.getArtwork().getId()));
        return match.map(m -> new CatalogOutcome(m.getArtwork(), false));
    }

    private Artwork insert(CatalogRequest request) {
        Museum museum = null;
        Long museumId = request.getScope() == null ? null : request.getScope().getNearestMuseumId();
        if (museumId != null) {
            museum = museumRepository.findById(museumId).orElse(null);
        }
        Artwork artwork = Artwork.builder()
                .museum(museum)
                .title(StringUtils.hasText(request.getTitle()) ? request.getTitle() : "Unknown Artwork")
                .artist(request.getArtist())
                .descriptionJson(descriptionJson.write(request.getDescription()))
                .imageUrl(request.getImageUrl())
                .embedding(request.getEmbedding())
                .verified(false)
                .source(ArtworkSource.AI_GENERATED)
                .confidenceScore(request.getConfidence())
                .build();
        return artworkRepository.saveAndFlush(artwork);
    }

    private void awaitCompetitor(InFlightCatalogRegistry.Claim claim) {
        try {
            if (!registry.await(claim, properties.getCatalog().getClaimWait())) {
                throw new CatalogUnavailableException("Timed out waiting for a concurrent catalog insert");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanCancelledException("catalog insert");
        }
    }

    private void backOff() {
        try {
            Thread.sleep(properties.getCatalog().getConflictBackoff().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanCancelledException("catalog insert");
        }
    }

    private void validate(CatalogRequest request) {
        if (request.getEmbedding() == null || request.getEmbedding().length != properties.getEmbedding().getDimension()) {
            throw new IllegalArgumentException("Catalog request needs a " + properties.getEmbedding().getDimension()
                    + "-dimensional embedding");
        }
        Double confidence = request.getConfidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence must lie in [0,1], got " + confidence);
        }
    }
}

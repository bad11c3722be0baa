package com.backend.artscan.service;

import com.backend.artscan.config.ArtScanProperties;
import com.backend.artscan.model.Artwork;
import com.backend.artscan.model.GeofenceScope;
import com.backend.artscan.model.MatchResult;
import com.backend.artscan.service.SimilarityIndex.Neighbor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether an embedding matches a known artwork. An empty result is the NoMatch outcome.
 */
@Slf4j
@Service
public class VectorMatchService {

    /** Smallest distance first; on exact ties museum_api/admin rows win, then the oldest row. */
    static final Comparator<Neighbor> PREFERENCE = Comparator
            .comparingDouble(Neighbor::getDistance)
            .thenComparing(n -> !isTrusted(n.getArtwork()))
            .thenComparing(n -> n.getArtwork().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    private final SimilarityIndex similarityIndex;
    private final ArtScanProperties.Match settings;

    public VectorMatchService(SimilarityIndex similarityIndex, ArtScanProperties properties) {
        this.similarityIndex = similarityIndex;
        this.settings = properties.getMatch();
    }

    public Optional<MatchResult> match(float[] embedding, GeofenceScope scope) {
        List<Neighbor> neighbors = similarityIndex.nearest(embedding, scope, settings.getCandidateLimit());
        Optional<MatchResult> result = select(neighbors, settings.getDistanceThreshold());
        if (result.isPresent()) {
            log.debug("Matched artwork {} at distance {} ({})", result.get().getArtwork().getId(),
                    result.get().getDistance(), result.get().getTier());
        } else {
            log.debug("No match among {} candidates in scope {}", neighbors.size(), scope.getMuseumIds());
        }
        return result;
    }

    static Optional<MatchResult> select(List<Neighbor> neighbors, double threshold) {
        return neighbors.stream()
                .filter(n -> n.getDistance() < threshold)
                .min(PREFERENCE)
                .map(n -> MatchResult.of(n.getArtwork(), n.getDistance()));
    }

    private static boolean isTrusted(Artwork artwork) {
        return artwork.getSource() != null && artwork.getSource().isTrusted();
    }
}

package com.backend.artscan.service;

import com.backend.artscan.model.Artwork;
import com.backend.artscan.model.GeofenceScope;
import com.backend.artscan.repository.ArtworkRepository;
import com.backend.artscan.util.VectorMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exhaustive cosine scan over the candidate rows loaded from the store. Candidates are ranked by the match
 * preference before the limit applies.
 */
@Component
@RequiredArgsConstructor
public class RepositorySimilarityIndex implements SimilarityIndex {

    private final ArtworkRepository artworkRepository;

    @Override
    public List<Neighbor> nearest(float[] query, GeofenceScope scope, int limit) {
        List<Artwork> candidates = scope.isEmpty()
                ? artworkRepository.findByMuseumIsNull()
                : artworkRepository.findUnaffiliatedOrInMuseums(scope.getMuseumIds());

        return candidates.stream()
                .filter(a -> a.getEmbedding() != null && a.getEmbedding().length == query.length)
                .map(a -> new Neighbor(a, VectorMath.cosineDistance(query, a.getEmbedding())))
                .sorted(VectorMatchService.PREFERENCE)
                .limit(limit)
                .collect(Collectors.toList());
    }
}

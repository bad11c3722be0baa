package com.backend.artscan.service;

import com.backend.artscan.model.Artwork;
import com.backend.artscan.model.GeofenceScope;
import lombok.Value;

import java.util.List;

/**
 * Nearest-neighbour query over artwork embeddings. Read-only.
 */
public interface SimilarityIndex {

    /**
     * Up to {@code limit} artworks in scope, by ascending cosine distance with trusted sources first on ties.
     * An empty scope searches unaffiliated artworks only.
     */
    List<Neighbor> nearest(float[] query, GeofenceScope scope, int limit);

    @Value
    class Neighbor {
        Artwork artwork;
        double distance;
    }
}

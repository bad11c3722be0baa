package com.backend.artscan.model;

import lombok.Value;

/**
 * An accepted nearest neighbour: the artwork, its trust tier and the cosine distance to the query.
 */
@Value
public class MatchResult {
    MatchTier tier;
    Artwork artwork;
    double distance;

    public static MatchResult of(Artwork artwork, double distance) {
        return new MatchResult(artwork.tier(), artwork, distance);
    }
}

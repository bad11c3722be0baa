package com.backend.artscan.model;

import lombok.Value;

import java.util.Set;

/**
 * Museums whose geofence contains the scan location. An empty scope restricts matching to unaffiliated artworks.
 */
@Value
public class GeofenceScope {
    Set<Long> museumIds;
    /** Closest qualifying museum, or null when the scope is empty. */
    Long nearestMuseumId;

    public static GeofenceScope empty() {
        return new GeofenceScope(Set.of(), null);
    }

    public boolean isEmpty() {
        return museumIds.isEmpty();
    }
}

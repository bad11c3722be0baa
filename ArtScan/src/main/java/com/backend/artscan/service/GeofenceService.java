package com.backend.artscan.service;

import com.backend.artscan.exception.GeofenceLookupFailedException;
import com.backend.artscan.model.GeofenceScope;
import com.backend.artscan.model.Museum;
import com.backend.artscan.repository.MuseumRepository;
import com.backend.artscan.util.GeoDistance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class GeofenceService {

    private final MuseumRepository museumRepository;

    /**
     * Museums whose geofence contains the point. A failed lookup degrades to the empty scope.
     */
    public GeofenceScope candidateMuseums(double latitude, double longitude) {
        List<Museum> museums;
        try {
            museums = loadMuseums();
        } catch (GeofenceLookupFailedException e) {
            log.warn("Geofence lookup failed, matching against unaffiliated artworks only: {}", e.getMessage());
            return GeofenceScope.empty();
        }

        Set<Long> inside = new LinkedHashSet<>();
        Long nearestId = null;
        double nearestDistance = Double.MAX_VALUE;
        for (Museum museum : museums) {
            double distance = GeoDistance.haversineMeters(
                    museum.getLatitude(), museum.getLongitude(), latitude, longitude);
            if (distance <= museum.getGeofenceRadiusMeters()) {
                inside.add(museum.getId());
                if (distance < nearestDistance) {
                    nearestDistance = distance;
                    nearestId = museum.getId();
                }
            }
        }
        if (inside.isEmpty()) {
            return GeofenceScope.empty();
        }
        log.debug("Scan at ({}, {}) is inside museums {}", latitude, longitude, inside);
        return new GeofenceScope(Set.copyOf(inside), nearestId);
    }

    private List<Museum> loadMuseums() {
        try {
            return museumRepository.findAll();
        } catch (DataAccessException e) {
            throw new GeofenceLookupFailedException("Cannot load museums", e);
        }
    }
}

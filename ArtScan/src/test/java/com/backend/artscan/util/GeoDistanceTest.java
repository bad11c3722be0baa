package com.backend.artscan.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class GeoDistanceTest {

    @Test
    public void samePointIsZero() {
        assertThat(GeoDistance.haversineMeters(48.8606, 2.3376, 48.8606, 2.3376)).isEqualTo(0.0);
    }

    @Test
    public void oneDegreeOfLatitudeIsAbout111Km() {
        assertThat(GeoDistance.haversineMeters(0, 0, 1, 0)).isCloseTo(111_195, within(10.0));
    }

    @Test
    public void louvreToOrsayIsUnderOneKilometre() {
        double meters = GeoDistance.haversineMeters(48.8606, 2.3376, 48.8600, 2.3266);
        assertThat(meters).isBetween(700.0, 900.0);
    }
}

package com.photoraces.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class GeoDistanceTest {

    private static final double METERS_PER_DEGREE = GeoDistance.EARTH_RADIUS_METERS * Math.PI / 180;

    @Test
    void testSamePointIsZero() {
        assertEquals(0, GeoDistance.haversineMeters(43.65, -79.38, 43.65, -79.38));
    }

    @Test
    void testOneDegreeOfLatitude() {
        assertEquals(METERS_PER_DEGREE, GeoDistance.haversineMeters(10, 20, 11, 20), 1e-6);
    }

    @Test
    void testOneDegreeOfLongitudeShrinksWithLatitude() {
        double atEquator = GeoDistance.haversineMeters(0, 0, 0, 1);
        double at60 = GeoDistance.haversineMeters(60, 0, 60, 1);
        assertEquals(METERS_PER_DEGREE, atEquator, 1e-6);
        assertEquals(METERS_PER_DEGREE / 2, at60, 1);
    }

    @Test
    void testSymmetric() {
        double ab = GeoDistance.haversineMeters(43.65, -79.38, 45.50, -73.57);
        double ba = GeoDistance.haversineMeters(45.50, -73.57, 43.65, -79.38);
        assertEquals(ab, ba, 1e-9);
        // Toronto to Montreal
        assertTrue(ab > 500_000 && ab < 510_000, "was " + ab);
    }

    @Test
    void testNanPropagates() {
        assertTrue(Double.isNaN(GeoDistance.haversineMeters(Double.NaN, 0, 1, 1)));
    }
}

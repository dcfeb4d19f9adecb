package com.photoraces.zones;

import java.util.List;

/**
 * Map math the zone planner needs from the surrounding system. Implementations must be pure.
 */
public interface ViewportCalculator {

    Bounds calculateBounds(List<? extends LatLng> points);

    /** Midpoint of the box, not the centroid of the points in it. */
    Coordinate calculateCenter(Bounds bounds);

    /** Zoom level at which {@code bounds} fits a viewport of {@code mapSize}. */
    double calculateZoom(Bounds bounds, MapSize mapSize);
}

package com.photoraces.zones;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches bounds, center and zoom to index clusters. Ids are positional placeholders until
 * {@link ZoneOrderer} renumbers them.
 */
final class ZoneBuilder {

    private final ViewportCalculator viewport;

    ZoneBuilder(ViewportCalculator viewport) {
        this.viewport = viewport;
    }

    List<Zone> build(List<List<Integer>> clusters, List<? extends LatLng> points, MapSize mapSize) {
        List<Zone> zones = new ArrayList<>(clusters.size());
        for (int i = 0; i < clusters.size(); i++) {
            zones.add(build(Zone.idForPosition(i), clusters.get(i), points, mapSize));
        }
        return zones;
    }

    Zone build(String id, List<Integer> poiIndices, List<? extends LatLng> points, MapSize mapSize) {
        List<LatLng> members = new ArrayList<>(poiIndices.size());
        for (int index : poiIndices) {
            members.add(points.get(index));
        }
        Bounds bounds = viewport.calculateBounds(members);
        Coordinate center = viewport.calculateCenter(bounds);
        double zoom = viewport.calculateZoom(bounds, mapSize);
        return new Zone(id, poiIndices, bounds, center, zoom);
    }
}

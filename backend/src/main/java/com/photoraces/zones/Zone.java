package com.photoraces.zones;

import java.util.List;
import java.util.Objects;

/**
 * A group of POIs shown together on one map view. {@code poiIndices} point into the list that was
 * planned; the POIs themselves are never copied.
 */
public final class Zone {
    private final String id;
    private final List<Integer> poiIndices;
    private final Bounds bounds;
    private final Coordinate center;
    private final double zoom;

    public Zone(String id, List<Integer> poiIndices, Bounds bounds, Coordinate center, double zoom) {
        this.id = id;
        this.poiIndices = List.copyOf(poiIndices);
        this.bounds = bounds;
        this.center = center;
        this.zoom = zoom;
    }

    public static String idForPosition(int position) {
        return "zone-" + position;
    }

    public Zone withId(String newId) {
        return new Zone(newId, poiIndices, bounds, center, zoom);
    }

    public String getId() {
        return id;
    }

    public List<Integer> getPoiIndices() {
        return poiIndices;
    }

    public int size() {
        return poiIndices.size();
    }

    public Bounds getBounds() {
        return bounds;
    }

    public Coordinate getCenter() {
        return center;
    }

    public double getZoom() {
        return zoom;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Zone other)) {
            return false;
        }
        return id.equals(other.id)
                && poiIndices.equals(other.poiIndices)
                && bounds.equals(other.bounds)
                && center.equals(other.center)
                && Double.compare(zoom, other.zoom) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, poiIndices, bounds, center, zoom);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s zoom=%.1f", id, poiIndices, bounds, zoom);
    }
}

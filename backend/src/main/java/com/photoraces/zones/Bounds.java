package com.photoraces.zones;

import java.util.Objects;

/**
 * Lat/lng bounding box in degrees. East and west are taken as-is; boxes crossing the antimeridian are not
 * normalized.
 */
public final class Bounds {
    private final double north;
    private final double south;
    private final double east;
    private final double west;

    public Bounds(double north, double south, double east, double west) {
        this.north = north;
        this.south = south;
        this.east = east;
        this.west = west;
    }

    public double getNorth() {
        return north;
    }

    public double getSouth() {
        return south;
    }

    public double getEast() {
        return east;
    }

    public double getWest() {
        return west;
    }

    public double lngSpan() {
        return east - west;
    }

    /**
     * Smallest box containing both this and {@code other}.
     */
    public Bounds union(Bounds other) {
        return new Bounds(
                Math.max(north, other.north),
                Math.min(south, other.south),
                Math.max(east, other.east),
                Math.min(west, other.west));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bounds other)) {
            return false;
        }
        return Double.compare(north, other.north) == 0
                && Double.compare(south, other.south) == 0
                && Double.compare(east, other.east) == 0
                && Double.compare(west, other.west) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(north, south, east, west);
    }

    @Override
    public String toString() {
        return String.format("Bounds[n=%.6f, s=%.6f, e=%.6f, w=%.6f]", north, south, east, west);
    }
}

package com.photoraces.zones;

import java.util.Objects;

/**
 * Immutable zone planning options. Start from {@link #defaults()} or {@link #builder()}; any option the
 * builder does not set keeps its default.
 *
 * <p>{@code minPoisPerZone} is a target only: a small cluster with no legal merge partner stays small.
 * {@code maxPoisPerZone} is never exceeded. Values are not validated here.
 */
public final class ZoneConfig {

    public static final int DEFAULT_MIN_POIS_PER_ZONE = 3;
    public static final int DEFAULT_MAX_POIS_PER_ZONE = 10;
    public static final double DEFAULT_CLUSTER_RADIUS_METERS = 1000;
    public static final MapSize DEFAULT_MAP_SIZE = new MapSize(400, 600);

    private static final ZoneConfig DEFAULTS = builder().build();

    private final int minPoisPerZone;
    private final int maxPoisPerZone;
    private final double clusterRadiusMeters;
    private final MapSize mapSize;

    private ZoneConfig(Builder builder) {
        this.minPoisPerZone = builder.minPoisPerZone;
        this.maxPoisPerZone = builder.maxPoisPerZone;
        this.clusterRadiusMeters = builder.clusterRadiusMeters;
        this.mapSize = builder.mapSize;
    }

    public static ZoneConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .minPoisPerZone(minPoisPerZone)
                .maxPoisPerZone(maxPoisPerZone)
                .clusterRadiusMeters(clusterRadiusMeters)
                .mapSize(mapSize);
    }

    public int getMinPoisPerZone() {
        return minPoisPerZone;
    }

    public int getMaxPoisPerZone() {
        return maxPoisPerZone;
    }

    public double getClusterRadiusMeters() {
        return clusterRadiusMeters;
    }

    public MapSize getMapSize() {
        return mapSize;
    }

    /**
     * Clusters whose centroids are further apart than this are never merged.
     */
    public double getMaxMergeDistanceMeters() {
        return clusterRadiusMeters * 3;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ZoneConfig other)) {
            return false;
        }
        return minPoisPerZone == other.minPoisPerZone
                && maxPoisPerZone == other.maxPoisPerZone
                && Double.compare(clusterRadiusMeters, other.clusterRadiusMeters) == 0
                && mapSize.equals(other.mapSize);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minPoisPerZone, maxPoisPerZone, clusterRadiusMeters, mapSize);
    }

    @Override
    public String toString() {
        return String.format("ZoneConfig[min=%d, max=%d, radius=%.1fm, map=%s]",
                minPoisPerZone, maxPoisPerZone, clusterRadiusMeters, mapSize);
    }

    public static final class Builder {
        private int minPoisPerZone = DEFAULT_MIN_POIS_PER_ZONE;
        private int maxPoisPerZone = DEFAULT_MAX_POIS_PER_ZONE;
        private double clusterRadiusMeters = DEFAULT_CLUSTER_RADIUS_METERS;
        private MapSize mapSize = DEFAULT_MAP_SIZE;

        private Builder() {
        }

        public Builder minPoisPerZone(int minPoisPerZone) {
            this.minPoisPerZone = minPoisPerZone;
            return this;
        }

        public Builder maxPoisPerZone(int maxPoisPerZone) {
            this.maxPoisPerZone = maxPoisPerZone;
            return this;
        }

        public Builder clusterRadiusMeters(double clusterRadiusMeters) {
            this.clusterRadiusMeters = clusterRadiusMeters;
            return this;
        }

        public Builder mapSize(MapSize mapSize) {
            this.mapSize = Objects.requireNonNull(mapSize, "mapSize");
            return this;
        }

        public ZoneConfig build() {
            return new ZoneConfig(this);
        }
    }
}

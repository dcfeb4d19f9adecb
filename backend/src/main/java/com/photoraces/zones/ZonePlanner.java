package com.photoraces.zones;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a race's checkpoints into zones sized for one map view each.
 *
 * <p>Pipeline: {@link GreedyClusterer} → {@link ClusterRebalancer} → {@link ZoneBuilder} → {@link ZoneOrderer}.
 * Nothing is kept between calls, so one instance can be shared by any number of threads. Identical input
 * and config always produce identical zones.
 *
 * <pre>{@code
 * List<Zone> zones = new ZonePlanner().planZones(checkpoints);
 * List<Checkpoint> first = ZonePlanner.getZonePOIs(checkpoints, zones.get(0));
 * }</pre>
 */
public class ZonePlanner {

    private static final Logger log = LoggerFactory.getLogger(ZonePlanner.class);

    private final ViewportCalculator viewport;
    private final ZoneBuilder zoneBuilder;

    public ZonePlanner() {
        this(new WebMercatorViewport());
    }

    public ZonePlanner(ViewportCalculator viewport) {
        this.viewport = viewport;
        this.zoneBuilder = new ZoneBuilder(viewport);
    }

    public ViewportCalculator getViewport() {
        return viewport;
    }

    public List<Zone> planZones(List<? extends LatLng> points) {
        return planZones(points, ZoneConfig.defaults());
    }

    public List<Zone> planZones(List<? extends LatLng> points, ZoneConfig config) {
        if (points.isEmpty()) {
            return Collections.emptyList();
        }
        ZoneConfig effective = config == null ? ZoneConfig.defaults() : config;

        List<List<Integer>> clusters = GreedyClusterer.cluster(
                points, effective.getClusterRadiusMeters(), effective.getMaxPoisPerZone());
        List<List<Integer>> balanced = ClusterRebalancer.rebalance(clusters, points, effective);
        List<Zone> zones = ZoneOrderer.order(zoneBuilder.build(balanced, points, effective.getMapSize()));

        log.debug("Planned {} zones from {} points ({} initial clusters, {})",
                zones.size(), points.size(), clusters.size(), effective);
        return zones;
    }

    /**
     * The caller's own POI objects for {@code zone}, in the zone's index order.
     */
    public static <T> List<T> getZonePOIs(List<T> points, Zone zone) {
        List<T> result = new ArrayList<>(zone.size());
        for (int index : zone.getPoiIndices()) {
            result.add(points.get(index));
        }
        return result;
    }

    /**
     * Box around every zone, or empty when there are no zones.
     */
    public static Optional<Bounds> calculateOverallBounds(List<Zone> zones) {
        Bounds overall = null;
        for (Zone zone : zones) {
            overall = overall == null ? zone.getBounds() : overall.union(zone.getBounds());
        }
        return Optional.ofNullable(overall);
    }
}

package com.photoraces.service;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.photoraces.config.AppProperties;
import com.photoraces.dto.ZoneConfigOverrides;
import com.photoraces.dto.ZoneDto;
import com.photoraces.dto.ZonePlanDto;
import com.photoraces.model.RacePoi;
import com.photoraces.util.GeoValidator;
import com.photoraces.zones.Bounds;
import com.photoraces.zones.MapSize;
import com.photoraces.zones.Zone;
import com.photoraces.zones.ZoneConfig;
import com.photoraces.zones.ZonePlanner;

/**
 * Validates race checkpoints and hands them to the {@link ZonePlanner}. The planner itself trusts its
 * input, so everything that comes from a request is checked here first.
 */
@Service
public class ZonePlanningService {

    private static final Logger log = LoggerFactory.getLogger(ZonePlanningService.class);

    private final ZonePlanner zonePlanner;
    private final ZoneConfig defaultConfig;
    private final AppProperties appProperties;

    public ZonePlanningService(ZonePlanner zonePlanner, ZoneConfig defaultConfig, AppProperties appProperties) {
        requireValidConfig(defaultConfig);
        this.zonePlanner = zonePlanner;
        this.defaultConfig = defaultConfig;
        this.appProperties = appProperties;
    }

    public ZoneConfig getDefaultConfig() {
        return defaultConfig;
    }

    public ZonePlanDto plan(List<RacePoi> pois, ZoneConfigOverrides overrides) {
        requireValidPois(pois);
        ZoneConfig config = resolveConfig(overrides);

        List<Zone> zones = zonePlanner.planZones(pois, config);
        List<ZoneDto> zoneDtos = new ArrayList<>(zones.size());
        for (Zone zone : zones) {
            zoneDtos.add(new ZoneDto(zone, ZonePlanner.getZonePOIs(pois, zone)));
        }
        Bounds overall = ZonePlanner.calculateOverallBounds(zones).orElse(null);

        log.info("Planned {} zones for {} checkpoints with {}", zones.size(), pois.size(), config);
        return new ZonePlanDto(zoneDtos, overall, config);
    }

    /**
     * Bounding box of the checkpoints, or null for an empty list.
     */
    public Bounds bounds(List<RacePoi> pois) {
        requireValidPois(pois);
        if (pois.isEmpty()) {
            return null;
        }
        return zonePlanner.getViewport().calculateBounds(pois);
    }

    ZoneConfig resolveConfig(ZoneConfigOverrides overrides) {
        if (overrides == null) {
            return defaultConfig;
        }
        ZoneConfig.Builder builder = defaultConfig.toBuilder();
        if (overrides.getMinPoisPerZone() != null) {
            builder.minPoisPerZone(overrides.getMinPoisPerZone());
        }
        if (overrides.getMaxPoisPerZone() != null) {
            builder.maxPoisPerZone(overrides.getMaxPoisPerZone());
        }
        if (overrides.getClusterRadiusMeters() != null) {
            builder.clusterRadiusMeters(overrides.getClusterRadiusMeters());
        }
        if (overrides.getMapWidth() != null || overrides.getMapHeight() != null) {
            MapSize current = defaultConfig.getMapSize();
            builder.mapSize(new MapSize(
                    overrides.getMapWidth() != null ? overrides.getMapWidth() : current.getWidth(),
                    overrides.getMapHeight() != null ? overrides.getMapHeight() : current.getHeight()));
        }
        ZoneConfig config = builder.build();
        requireValidConfig(config);
        return config;
    }

    private void requireValidPois(List<RacePoi> pois) {
        if (pois == null) {
            throw new IllegalArgumentException("pois is required");
        }
        int limit = appProperties.getZones().getMaxPoisPerRequest();
        if (pois.size() > limit) {
            throw new IllegalArgumentException("Too many pois: " + pois.size() + " (max " + limit + ")");
        }
        GeoValidator.requireValidPoints(pois);
    }

    private static void requireValidConfig(ZoneConfig config) {
        if (config.getMinPoisPerZone() <= 0) {
            throw new IllegalArgumentException("minPoisPerZone must be positive");
        }
        if (config.getMaxPoisPerZone() < config.getMinPoisPerZone()) {
            throw new IllegalArgumentException("maxPoisPerZone must be at least minPoisPerZone");
        }
        if (!(config.getClusterRadiusMeters() > 0) || Double.isInfinite(config.getClusterRadiusMeters())) {
            throw new IllegalArgumentException("clusterRadiusMeters must be a positive number");
        }
        if (config.getMapSize().getWidth() <= 0 || config.getMapSize().getHeight() <= 0) {
            throw new IllegalArgumentException("map size must be positive");
        }
    }
}

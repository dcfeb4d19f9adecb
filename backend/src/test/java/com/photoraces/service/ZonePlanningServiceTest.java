package com.photoraces.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.photoraces.config.AppProperties;
import com.photoraces.config.ZonePlannerConfig;
import com.photoraces.dto.ZoneConfigOverrides;
import com.photoraces.dto.ZonePlanDto;
import com.photoraces.model.RacePoi;
import com.photoraces.model.ValidationType;
import com.photoraces.zones.Bounds;
import com.photoraces.zones.MapSize;
import com.photoraces.zones.ZoneConfig;

class ZonePlanningServiceTest {

    private static final double DEG_PER_METER = 1 / 111_194.93;

    private AppProperties appProperties;
    private ZonePlanningService service;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        ZonePlannerConfig config = new ZonePlannerConfig();
        service = new ZonePlanningService(
                config.zonePlanner(config.viewportCalculator()),
                config.defaultZoneConfig(appProperties),
                appProperties);
    }

    private static List<RacePoi> line(int count, double spacingMeters) {
        List<RacePoi> pois = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            pois.add(new RacePoi(43.65 - i * spacingMeters * DEG_PER_METER, -79.38,
                    "Stop " + i, "Clue " + i, ValidationType.PHOTO_ONLY));
        }
        return pois;
    }

    @Test
    void planResolvesZonePois() {
        List<RacePoi> pois = line(4, 20);
        ZonePlanDto plan = service.plan(pois, null);

        assertThat(plan.getZones()).hasSize(1);
        assertThat(plan.getZones().get(0).getPois()).containsExactlyElementsOf(pois);
        assertThat(plan.getOverallBounds()).isEqualTo(service.bounds(pois));
        assertThat(plan.getConfig()).isEqualTo(ZoneConfig.defaults());
    }

    @Test
    void planOfNothingHasNoZones() {
        ZonePlanDto plan = service.plan(List.of(), null);
        assertThat(plan.getZones()).isEmpty();
        assertThat(plan.getOverallBounds()).isNull();
    }

    @Test
    void overridesMergeOntoDefaults() {
        ZoneConfigOverrides overrides = new ZoneConfigOverrides();
        overrides.setMinPoisPerZone(1);
        overrides.setMaxPoisPerZone(2);
        overrides.setMapHeight(800);

        ZoneConfig config = service.resolveConfig(overrides);
        assertThat(config.getMinPoisPerZone()).isEqualTo(1);
        assertThat(config.getMaxPoisPerZone()).isEqualTo(2);
        assertThat(config.getClusterRadiusMeters()).isEqualTo(1000);
        assertThat(config.getMapSize()).isEqualTo(new MapSize(400, 800));

        ZonePlanDto plan = service.plan(line(5, 10), overrides);
        assertThat(plan.getZones()).hasSize(3);
        assertThat(plan.getZones()).allSatisfy(zone -> assertThat(zone.getPoiIndices().size()).isLessThanOrEqualTo(2));
    }

    @Test
    void defaultsComeFromProperties() {
        appProperties.getZones().setMaxPoisPerZone(4);
        ZonePlannerConfig config = new ZonePlannerConfig();
        ZoneConfig zoneConfig = config.defaultZoneConfig(appProperties);
        assertThat(zoneConfig.getMaxPoisPerZone()).isEqualTo(4);
        assertThat(zoneConfig.getMinPoisPerZone()).isEqualTo(3);
    }

    @Test
    void rejectsInvalidConfiguredDefaults() {
        appProperties.getZones().setMinPoisPerZone(5);
        appProperties.getZones().setMaxPoisPerZone(2);
        ZonePlannerConfig config = new ZonePlannerConfig();
        assertThatThrownBy(() -> new ZonePlanningService(
                config.zonePlanner(config.viewportCalculator()),
                config.defaultZoneConfig(appProperties),
                appProperties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxPoisPerZone");
    }

    @Test
    void rejectsOutOfRangeCoordinates() {
        List<RacePoi> pois = List.of(new RacePoi(43.65, -79.38), new RacePoi(95, -79.38));
        assertThatThrownBy(() -> service.plan(pois, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pois[1]");
    }

    @Test
    void rejectsTooManyPois() {
        appProperties.getZones().setMaxPoisPerRequest(3);
        assertThatThrownBy(() -> service.plan(line(4, 10), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Too many pois");
    }

    @Test
    void rejectsMinAboveMax() {
        ZoneConfigOverrides overrides = new ZoneConfigOverrides();
        overrides.setMinPoisPerZone(5);
        overrides.setMaxPoisPerZone(4);
        assertThatThrownBy(() -> service.plan(line(2, 10), overrides))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxPoisPerZone");
    }

    @Test
    void rejectsNonPositiveRadius() {
        ZoneConfigOverrides overrides = new ZoneConfigOverrides();
        overrides.setClusterRadiusMeters(0d);
        assertThatThrownBy(() -> service.resolveConfig(overrides))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("clusterRadiusMeters");
    }

    @Test
    void boundsOfNothingIsNull() {
        assertThat(service.bounds(List.of())).isNull();
        assertThat(service.bounds(List.of(new RacePoi(1, 2), new RacePoi(3, 4))))
                .isEqualTo(new Bounds(3, 1, 4, 2));
    }
}

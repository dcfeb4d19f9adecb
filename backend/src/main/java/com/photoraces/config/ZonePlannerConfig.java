package com.photoraces.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.photoraces.zones.MapSize;
import com.photoraces.zones.ViewportCalculator;
import com.photoraces.zones.WebMercatorViewport;
import com.photoraces.zones.ZoneConfig;
import com.photoraces.zones.ZonePlanner;

@Configuration
public class ZonePlannerConfig {

    @Bean
    public ViewportCalculator viewportCalculator() {
        return new WebMercatorViewport();
    }

    @Bean
    public ZonePlanner zonePlanner(ViewportCalculator viewportCalculator) {
        return new ZonePlanner(viewportCalculator);
    }

    @Bean
    public ZoneConfig defaultZoneConfig(AppProperties appProperties) {
        AppProperties.Zones zones = appProperties.getZones();
        return ZoneConfig.builder()
                .minPoisPerZone(zones.getMinPoisPerZone())
                .maxPoisPerZone(zones.getMaxPoisPerZone())
                .clusterRadiusMeters(zones.getClusterRadiusMeters())
                .mapSize(new MapSize(zones.getMapWidth(), zones.getMapHeight()))
                .build();
    }
}

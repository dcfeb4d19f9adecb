package com.photoraces.dto;

import java.util.List;

import com.photoraces.zones.Bounds;
import com.photoraces.zones.ZoneConfig;

public class ZonePlanDto {
    private final List<ZoneDto> zones;
    private final Bounds overallBounds;
    private final ZoneConfig config;

    public ZonePlanDto(List<ZoneDto> zones, Bounds overallBounds, ZoneConfig config) {
        this.zones = zones;
        this.overallBounds = overallBounds;
        this.config = config;
    }

    public List<ZoneDto> getZones() {
        return zones;
    }

    /** Null when there are no zones. */
    public Bounds getOverallBounds() {
        return overallBounds;
    }

    public ZoneConfig getConfig() {
        return config;
    }
}

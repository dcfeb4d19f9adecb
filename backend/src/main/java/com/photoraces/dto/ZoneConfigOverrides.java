package com.photoraces.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Per-request zone options. A null field keeps the configured default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ZoneConfigOverrides {
    private Integer minPoisPerZone;
    private Integer maxPoisPerZone;
    private Double clusterRadiusMeters;
    private Integer mapWidth;
    private Integer mapHeight;

    public Integer getMinPoisPerZone() {
        return minPoisPerZone;
    }

    public void setMinPoisPerZone(Integer minPoisPerZone) {
        this.minPoisPerZone = minPoisPerZone;
    }

    public Integer getMaxPoisPerZone() {
        return maxPoisPerZone;
    }

    public void setMaxPoisPerZone(Integer maxPoisPerZone) {
        this.maxPoisPerZone = maxPoisPerZone;
    }

    public Double getClusterRadiusMeters() {
        return clusterRadiusMeters;
    }

    public void setClusterRadiusMeters(Double clusterRadiusMeters) {
        this.clusterRadiusMeters = clusterRadiusMeters;
    }

    public Integer getMapWidth() {
        return mapWidth;
    }

    public void setMapWidth(Integer mapWidth) {
        this.mapWidth = mapWidth;
    }

    public Integer getMapHeight() {
        return mapHeight;
    }

    public void setMapHeight(Integer mapHeight) {
        this.mapHeight = mapHeight;
    }
}

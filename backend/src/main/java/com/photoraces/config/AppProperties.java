package com.photoraces.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Zones zones = new Zones();

    public Zones getZones() {
        return zones;
    }

    /**
     * Defaults applied to every zone plan unless the request overrides them.
     */
    public static class Zones {
        private int minPoisPerZone = 3;
        private int maxPoisPerZone = 10;
        private double clusterRadiusMeters = 1000;
        private int mapWidth = 400;
        private int mapHeight = 600;
        private int maxPoisPerRequest = 500;

        public int getMinPoisPerZone() {
            return minPoisPerZone;
        }

        public void setMinPoisPerZone(int minPoisPerZone) {
            this.minPoisPerZone = minPoisPerZone;
        }

        public int getMaxPoisPerZone() {
            return maxPoisPerZone;
        }

        public void setMaxPoisPerZone(int maxPoisPerZone) {
            this.maxPoisPerZone = maxPoisPerZone;
        }

        public double getClusterRadiusMeters() {
            return clusterRadiusMeters;
        }

        public void setClusterRadiusMeters(double clusterRadiusMeters) {
            this.clusterRadiusMeters = clusterRadiusMeters;
        }

        public int getMapWidth() {
            return mapWidth;
        }

        public void setMapWidth(int mapWidth) {
            this.mapWidth = mapWidth;
        }

        public int getMapHeight() {
            return mapHeight;
        }

        public void setMapHeight(int mapHeight) {
            this.mapHeight = mapHeight;
        }

        public int getMaxPoisPerRequest() {
            return maxPoisPerRequest;
        }

        public void setMaxPoisPerRequest(int maxPoisPerRequest) {
            this.maxPoisPerRequest = maxPoisPerRequest;
        }
    }
}

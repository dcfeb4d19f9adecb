package com.photoraces.dto;

import java.util.List;

import com.photoraces.model.RacePoi;
import com.photoraces.zones.Bounds;
import com.photoraces.zones.Coordinate;
import com.photoraces.zones.Zone;

public class ZoneDto {
    private final String id;
    private final List<Integer> poiIndices;
    private final Bounds bounds;
    private final Coordinate center;
    private final double zoom;
    private final List<RacePoi> pois;

    public ZoneDto(Zone zone, List<RacePoi> pois) {
        this.id = zone.getId();
        this.poiIndices = zone.getPoiIndices();
        this.bounds = zone.getBounds();
        this.center = zone.getCenter();
        this.zoom = zone.getZoom();
        this.pois = pois;
    }

    public String getId() {
        return id;
    }

    public List<Integer> getPoiIndices() {
        return poiIndices;
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

    public List<RacePoi> getPois() {
        return pois;
    }
}

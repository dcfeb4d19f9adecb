package com.photoraces.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.photoraces.zones.LatLng;

import jakarta.validation.constraints.NotNull;

/**
 * A race checkpoint. Zone planning only reads the coordinates; name, clue and validation type ride along.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RacePoi implements LatLng {

    @NotNull
    private Double lat;
    @NotNull
    private Double lng;
    private String name;
    private String clue;
    private ValidationType validationType;

    public RacePoi() {
    }

    public RacePoi(double lat, double lng) {
        this.lat = lat;
        this.lng = lng;
    }

    public RacePoi(double lat, double lng, String name, String clue, ValidationType validationType) {
        this(lat, lng);
        this.name = name;
        this.clue = clue;
        this.validationType = validationType;
    }

    @Override
    public double getLat() {
        return lat;
    }

    public void setLat(Double lat) {
        this.lat = lat;
    }

    @Override
    public double getLng() {
        return lng;
    }

    public void setLng(Double lng) {
        this.lng = lng;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getClue() {
        return clue;
    }

    public void setClue(String clue) {
        this.clue = clue;
    }

    public ValidationType getValidationType() {
        return validationType;
    }

    public void setValidationType(ValidationType validationType) {
        this.validationType = validationType;
    }
}

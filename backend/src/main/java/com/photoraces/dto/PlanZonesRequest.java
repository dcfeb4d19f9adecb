package com.photoraces.dto;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.photoraces.model.RacePoi;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PlanZonesRequest {

    @NotNull
    @Valid
    private List<RacePoi> pois = new ArrayList<>();

    private ZoneConfigOverrides config;

    public List<RacePoi> getPois() {
        return pois;
    }

    public void setPois(List<RacePoi> pois) {
        this.pois = pois;
    }

    public ZoneConfigOverrides getConfig() {
        return config;
    }

    public void setConfig(ZoneConfigOverrides config) {
        this.config = config;
    }
}

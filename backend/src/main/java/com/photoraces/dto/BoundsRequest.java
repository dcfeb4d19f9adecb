package com.photoraces.dto;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.photoraces.model.RacePoi;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Body of the bounds endpoint. Only {@code pois} is read; zone options have no effect on a bounding box, so
 * a {@code config} field is ignored like any other unknown field.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BoundsRequest {

    @NotNull
    @Valid
    private List<RacePoi> pois = new ArrayList<>();

    public List<RacePoi> getPois() {
        return pois;
    }

    public void setPois(List<RacePoi> pois) {
        this.pois = pois;
    }
}

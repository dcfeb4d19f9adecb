package com.photoraces.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.photoraces.dto.ApiResponse;
import com.photoraces.dto.BoundsRequest;
import com.photoraces.dto.PlanZonesRequest;
import com.photoraces.dto.ZonePlanDto;
import com.photoraces.service.ZonePlanningService;
import com.photoraces.zones.Bounds;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1/zones")
@Validated
public class ZoneController {

    private final ZonePlanningService zonePlanningService;

    public ZoneController(ZonePlanningService zonePlanningService) {
        this.zonePlanningService = zonePlanningService;
    }

    @PostMapping("/plan")
    public ResponseEntity<?> plan(@RequestBody @Valid PlanZonesRequest request) {
        ZonePlanDto plan = zonePlanningService.plan(request.getPois(), request.getConfig());
        return ResponseEntity.ok(ApiResponse.ok(plan, plan.getZones().size()));
    }

    @PostMapping("/bounds")
    public ResponseEntity<?> bounds(@RequestBody @Valid BoundsRequest request) {
        Bounds bounds = zonePlanningService.bounds(request.getPois());
        return ResponseEntity.ok(ApiResponse.ok(bounds));
    }

    @GetMapping("/config")
    public ResponseEntity<?> config() {
        return ResponseEntity.ok(ApiResponse.ok(zonePlanningService.getDefaultConfig()));
    }
}

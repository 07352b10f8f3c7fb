package com.gocomet.zonerevenue.zone.controller;

import com.gocomet.zonerevenue.zone.dto.ZoneResponse;
import com.gocomet.zonerevenue.zone.service.ZoneService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/zones")
@RequiredArgsConstructor
public class ZoneController {

    private final ZoneService zoneService;

    /**
     * GET /v1/zones — List zones, optionally by borough
     */
    @GetMapping
    public ResponseEntity<List<ZoneResponse>> getZones(@RequestParam(required = false) String borough) {
        return ResponseEntity.ok(zoneService.getZones(borough));
    }

    /**
     * GET /v1/zones/{locationId} — Get a single zone
     */
    @GetMapping("/{locationId}")
    public ResponseEntity<ZoneResponse> getZone(@PathVariable Integer locationId) {
        return ResponseEntity.ok(zoneService.getZone(locationId));
    }
}

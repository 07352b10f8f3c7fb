package com.gocomet.zonerevenue.aggregation.controller;

import com.gocomet.zonerevenue.aggregation.dto.AggregationRunResponse;
import com.gocomet.zonerevenue.aggregation.dto.MonthlyZoneRevenueResponse;
import com.gocomet.zonerevenue.aggregation.dto.MonthlyZoneStatisticResponse;
import com.gocomet.zonerevenue.aggregation.service.ZoneAggregationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/aggregations/monthly-zone")
@RequiredArgsConstructor
public class AggregationController {

    private final ZoneAggregationService aggregationService;

    /**
     * POST /v1/aggregations/monthly-zone/refresh — Rebuild statistics and revenue tables
     */
    @PostMapping("/refresh")
    public ResponseEntity<AggregationRunResponse> refresh() {
        return ResponseEntity.ok(aggregationService.refresh());
    }

    /**
     * GET /v1/aggregations/monthly-zone/statistics — Published zone statistics
     */
    @GetMapping("/statistics")
    public ResponseEntity<List<MonthlyZoneStatisticResponse>> getStatistics(
            @RequestParam(required = false) String zone,
            @RequestParam(required = false) String serviceType) {

        return ResponseEntity.ok(aggregationService.getStatistics(zone, serviceType));
    }

    /**
     * GET /v1/aggregations/monthly-zone/revenue — Published zone revenue
     */
    @GetMapping("/revenue")
    public ResponseEntity<List<MonthlyZoneRevenueResponse>> getRevenue(
            @RequestParam(required = false) String zone,
            @RequestParam(required = false) String serviceType) {

        return ResponseEntity.ok(aggregationService.getRevenue(zone, serviceType));
    }
}

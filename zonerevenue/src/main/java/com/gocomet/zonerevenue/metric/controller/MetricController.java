package com.gocomet.zonerevenue.metric.controller;

import com.gocomet.zonerevenue.metric.dto.MetricDefinitionResponse;
import com.gocomet.zonerevenue.metric.dto.MetricResultResponse;
import com.gocomet.zonerevenue.metric.model.MetricSeries;
import com.gocomet.zonerevenue.metric.service.MetricService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/metrics")
@RequiredArgsConstructor
public class MetricController {

    private final MetricService metricService;

    /**
     * GET /v1/metrics — List configured metric definitions
     */
    @GetMapping
    public ResponseEntity<List<MetricDefinitionResponse>> getDefinitions() {
        return ResponseEntity.ok(metricService.getDefinitions());
    }

    /**
     * GET /v1/metrics/{name}?grain=month — Time series of one metric
     */
    @GetMapping("/{name}")
    public ResponseEntity<MetricSeries> evaluate(
            @PathVariable String name,
            @RequestParam(defaultValue = "month") String grain) {

        return ResponseEntity.ok(metricService.evaluate(name, grain));
    }

    /**
     * POST /v1/metrics/evaluate?grains=month,quarter — Evaluate every metric
     */
    @PostMapping("/evaluate")
    public ResponseEntity<List<MetricResultResponse>> evaluateAll(
            @RequestParam(defaultValue = "month") List<String> grains) {

        return ResponseEntity.ok(metricService.evaluateAll(grains));
    }
}

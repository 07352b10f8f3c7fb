package com.gocomet.zonerevenue.config;

import com.gocomet.zonerevenue.metric.model.CalculationMethod;
import com.gocomet.zonerevenue.metric.model.FilterOperator;
import com.gocomet.zonerevenue.metric.model.TimeGrain;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/v1/config")
public class ConfigController {

    /**
     * GET /v1/config/time-grains — List supported time grains.
     */
    @GetMapping("/time-grains")
    public ResponseEntity<List<String>> getTimeGrains() {
        List<String> grains = Arrays.stream(TimeGrain.values())
                .map(TimeGrain::label)
                .toList();
        return ResponseEntity.ok(grains);
    }

    /**
     * GET /v1/config/calculation-methods — List supported calculation methods.
     */
    @GetMapping("/calculation-methods")
    public ResponseEntity<List<String>> getCalculationMethods() {
        List<String> methods = Arrays.stream(CalculationMethod.values())
                .map(CalculationMethod::label)
                .toList();
        return ResponseEntity.ok(methods);
    }

    /**
     * GET /v1/config/filter-operators — List supported filter operators.
     */
    @GetMapping("/filter-operators")
    public ResponseEntity<List<String>> getFilterOperators() {
        List<String> operators = Arrays.stream(FilterOperator.values())
                .map(FilterOperator::symbol)
                .toList();
        return ResponseEntity.ok(operators);
    }
}

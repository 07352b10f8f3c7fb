package com.gocomet.zonerevenue.metric.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Declarative description of a metric: what to compute ({@link #expression}
 * folded by {@link #calculationMethod}), along which time axis, and under
 * which filters. Column references stay textual until evaluation.
 */
@Value
@Builder(toBuilder = true)
public class MetricDefinition {

    String name;
    String label;
    String description;

    @Builder.Default
    String model = "fact_trips";

    String expression;
    CalculationMethod calculationMethod;
    String timestamp;

    @Builder.Default
    List<TimeGrain> timeGrains = List.of();

    /** ANDed together, in declaration order. */
    @Builder.Default
    List<MetricFilter> filters = List.of();
}

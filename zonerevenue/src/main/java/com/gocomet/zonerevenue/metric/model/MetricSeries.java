package com.gocomet.zonerevenue.metric.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MetricSeries {

    String metricName;
    String label;
    CalculationMethod calculationMethod;
    TimeGrain grain;

    /** Ordered by bucket start; buckets without rows are absent. */
    List<MetricPoint> points;
}

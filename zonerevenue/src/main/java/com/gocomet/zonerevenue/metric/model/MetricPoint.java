package com.gocomet.zonerevenue.metric.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class MetricPoint {

    LocalDate bucketStart;
    BigDecimal value;
}

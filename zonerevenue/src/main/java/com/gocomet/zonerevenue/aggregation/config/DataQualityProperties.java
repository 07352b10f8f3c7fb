package com.gocomet.zonerevenue.aggregation.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "app.data-quality")
@Validated
@Getter
@Setter
public class DataQualityProperties {

    /** Share of null values above which a column is reported. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double maxNullRatio = 0.05;

    /** Per-column overrides of {@link #maxNullRatio}, keyed by column name. */
    private Map<String, Double> nullRatioOverrides = new HashMap<>();

    /** Allowed gap between total_amount and the sum of the other charges. */
    private BigDecimal totalAmountTolerance = new BigDecimal("0.01");

    public double maxNullRatioFor(String column) {
        return nullRatioOverrides.getOrDefault(column, maxNullRatio);
    }
}

package com.gocomet.zonerevenue.metric.model;

import com.gocomet.zonerevenue.common.aggregate.Accumulator;
import com.gocomet.zonerevenue.common.aggregate.DecimalAverage;
import com.gocomet.zonerevenue.common.aggregate.DecimalSum;
import com.gocomet.zonerevenue.common.aggregate.DistinctCount;
import com.gocomet.zonerevenue.common.aggregate.Extreme;
import com.gocomet.zonerevenue.common.aggregate.NonNullCount;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Supplier;

public enum CalculationMethod {

    COUNT("count", false, NonNullCount::new),
    COUNT_DISTINCT("count_distinct", false, DistinctCount::new),
    SUM("sum", true, DecimalSum::new),
    AVERAGE("average", true, DecimalAverage::new),
    MIN("min", true, Extreme::min),
    MAX("max", true, Extreme::max);

    private final String label;
    private final boolean numericOnly;
    private final Supplier<Accumulator> accumulatorFactory;

    CalculationMethod(String label, boolean numericOnly, Supplier<Accumulator> accumulatorFactory) {
        this.label = label;
        this.numericOnly = numericOnly;
        this.accumulatorFactory = accumulatorFactory;
    }

    public String label() {
        return label;
    }

    public boolean isNumericOnly() {
        return numericOnly;
    }

    public Accumulator newAccumulator() {
        return accumulatorFactory.get();
    }

    public static Optional<CalculationMethod> find(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(method -> method.label.equalsIgnoreCase(label.trim()))
                .findFirst();
    }
}

package com.gocomet.zonerevenue.common.aggregate;

import java.math.BigDecimal;

/**
 * Minimum or maximum of numeric values, compared as decimals so that
 * {@code 2} and {@code 2.0} are equal.
 */
public class Extreme implements Accumulator {

    private final boolean maximum;
    private BigDecimal current;

    private Extreme(boolean maximum) {
        this.maximum = maximum;
    }

    public static Extreme min() {
        return new Extreme(false);
    }

    public static Extreme max() {
        return new Extreme(true);
    }

    @Override
    public void add(Object value) {
        if (value == null) {
            return;
        }
        BigDecimal candidate = Numbers.toBigDecimal(value);
        if (current == null) {
            current = candidate;
            return;
        }
        int comparison = candidate.compareTo(current);
        if (maximum ? comparison > 0 : comparison < 0) {
            current = candidate;
        }
    }

    @Override
    public BigDecimal result() {
        return current;
    }
}

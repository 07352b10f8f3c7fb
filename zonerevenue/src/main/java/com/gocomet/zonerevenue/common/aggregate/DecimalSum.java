package com.gocomet.zonerevenue.common.aggregate;

import java.math.BigDecimal;

/**
 * Exact sum. Addition of {@link BigDecimal} is associative, so the result does
 * not depend on the order rows are visited in.
 *
 * {@code NaN} and infinite doubles are summed apart with IEEE rules and
 * dominate the double result, as they would in a floating-point sum. They
 * have no decimal value, so {@link #result()} rejects them.
 */
public class DecimalSum implements Accumulator {

    private BigDecimal sum;
    private Double nonFinite;

    @Override
    public void add(Object value) {
        if (value == null) {
            return;
        }
        if (Numbers.isNonFinite(value)) {
            double d = ((Number) value).doubleValue();
            nonFinite = nonFinite == null ? d : nonFinite + d;
            return;
        }
        BigDecimal decimal = Numbers.toBigDecimal(value);
        sum = sum == null ? decimal : sum.add(decimal);
    }

    /**
     * @throws ArithmeticException if a {@code NaN} or infinite value was added
     */
    @Override
    public BigDecimal result() {
        if (nonFinite != null) {
            throw new ArithmeticException("Sum is " + nonFinite + ", which has no decimal representation");
        }
        return sum;
    }

    public Double doubleResult() {
        if (nonFinite != null) {
            return nonFinite;
        }
        return sum == null ? null : sum.doubleValue();
    }

    boolean isFinite() {
        return nonFinite == null;
    }
}

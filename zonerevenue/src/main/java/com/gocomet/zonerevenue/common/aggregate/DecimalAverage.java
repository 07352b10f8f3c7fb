package com.gocomet.zonerevenue.common.aggregate;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Mean over non-null values. The running sum is exact and the single division
 * happens at the end, which keeps results identical across visitation orders.
 * A {@code NaN} or infinite input carries through to {@link #doubleResult()}.
 */
public class DecimalAverage implements Accumulator {

    private final DecimalSum sum = new DecimalSum();
    private long count;

    @Override
    public void add(Object value) {
        if (value == null) {
            return;
        }
        sum.add(value);
        count++;
    }

    /**
     * @throws ArithmeticException if a {@code NaN} or infinite value was added
     */
    @Override
    public BigDecimal result() {
        if (count == 0) {
            return null;
        }
        return sum.result().divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
    }

    public Double doubleResult() {
        if (count == 0) {
            return null;
        }
        if (!sum.isFinite()) {
            // NaN and infinities are unchanged by division by a positive count
            return sum.doubleResult();
        }
        return result().doubleValue();
    }
}

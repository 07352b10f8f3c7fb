package com.gocomet.zonerevenue.common.aggregate;

import java.math.BigDecimal;
import java.math.BigInteger;

public final class Numbers {

    private Numbers() {
    }

    /**
     * Widens any numeric column value to {@link BigDecimal}. Doubles go through
     * their shortest decimal representation so {@code 3.1} stays {@code 3.1}.
     *
     * @throws ArithmeticException for {@code NaN} and infinities
     */
    public static BigDecimal toBigDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) {
                throw new ArithmeticException("Non-finite value " + d + " has no decimal representation");
            }
            return BigDecimal.valueOf(d);
        }
        throw new IllegalArgumentException("Not a numeric value: " + value.getClass().getSimpleName());
    }

    /**
     * True for {@code NaN} and infinite doubles or floats, which have no exact
     * decimal value.
     */
    public static boolean isNonFinite(Object value) {
        return (value instanceof Double || value instanceof Float) && !Double.isFinite(((Number) value).doubleValue());
    }
}

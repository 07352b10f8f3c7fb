package com.gocomet.zonerevenue.common.aggregate;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

public class DistinctCount implements Accumulator {

    private final Set<Object> seen = new HashSet<>();

    @Override
    public void add(Object value) {
        if (value == null) {
            return;
        }
        // 2 and 2.0 are the same value
        seen.add(value instanceof BigDecimal decimal ? decimal.stripTrailingZeros() : value);
    }

    @Override
    public Long result() {
        return (long) seen.size();
    }
}

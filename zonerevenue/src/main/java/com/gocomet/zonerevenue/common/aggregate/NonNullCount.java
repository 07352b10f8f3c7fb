package com.gocomet.zonerevenue.common.aggregate;

public class NonNullCount implements Accumulator {

    private long count;

    @Override
    public void add(Object value) {
        if (value != null) {
            count++;
        }
    }

    @Override
    public Long result() {
        return count;
    }
}

package com.gocomet.zonerevenue.common.aggregate;

/**
 * Folds column values into one aggregate with SQL semantics: nulls are skipped,
 * and an accumulator that saw no non-null value reports {@code null}
 * (counts report zero).
 */
public interface Accumulator {

    void add(Object value);

    Object result();
}

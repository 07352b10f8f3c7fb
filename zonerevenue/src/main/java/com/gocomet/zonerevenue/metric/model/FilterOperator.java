package com.gocomet.zonerevenue.metric.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum FilterOperator {

    EQUALS(List.of("=", "==")),
    NOT_EQUALS(List.of("!=", "<>")),
    IS(List.of("is")),
    IS_NOT(List.of("is not"));

    private final List<String> symbols;

    FilterOperator(List<String> symbols) {
        this.symbols = symbols;
    }

    public String symbol() {
        return symbols.get(0);
    }

    /** IS and IS NOT only take a null literal; the others never do. */
    public boolean comparesWithNull() {
        return this == IS || this == IS_NOT;
    }

    public static Optional<FilterOperator> find(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String normalized = symbol.trim().replaceAll("\\s+", " ").toLowerCase();
        return Arrays.stream(values())
                .filter(operator -> operator.symbols.contains(normalized))
                .findFirst();
    }
}

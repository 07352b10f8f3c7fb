package com.gocomet.zonerevenue.metric.model;

import lombok.Value;

/**
 * One {@code field operator value} predicate. The value keeps SQL literal
 * spelling: {@code 'Manhattan'} is text, {@code 2} a number, {@code null} null.
 */
@Value
public class MetricFilter {

    String field;
    FilterOperator operator;
    String value;

    public static MetricFilter equalTo(String field, String value) {
        return new MetricFilter(field, FilterOperator.EQUALS, value);
    }

    /**
     * The literal with SQL quoting removed, or {@code null} for the null literal.
     */
    public String literal() {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("null")) {
            return null;
        }
        if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("''", "'");
        }
        return trimmed;
    }

    @Override
    public String toString() {
        return field + " " + operator.symbol() + " " + value;
    }
}

package com.gocomet.zonerevenue.trip.model;

import com.gocomet.zonerevenue.common.aggregate.Numbers;

import java.math.BigDecimal;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Set;

/**
 * Logical value type of a fact column. Maps JDBC types onto a compatible
 * family and coerces configuration literals into comparable values.
 */
public enum ColumnType {

    TEXT(Set.of(Types.VARCHAR, Types.CHAR, Types.LONGVARCHAR, Types.NVARCHAR, Types.NCHAR,
            Types.LONGNVARCHAR, Types.CLOB)),
    INTEGER(Set.of(Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT, Types.NUMERIC, Types.DECIMAL)),
    NUMERIC(Set.of(Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT, Types.NUMERIC, Types.DECIMAL,
            Types.REAL, Types.FLOAT, Types.DOUBLE)),
    TIMESTAMP(Set.of(Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE, Types.DATE));

    private final Set<Integer> jdbcTypes;

    ColumnType(Set<Integer> jdbcTypes) {
        this.jdbcTypes = jdbcTypes;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == NUMERIC;
    }

    public boolean acceptsJdbcType(int jdbcType) {
        return jdbcTypes.contains(jdbcType);
    }

    /**
     * Converts a filter literal into the representation column values of this
     * type are compared in: {@link BigDecimal} for numbers, {@link LocalDateTime}
     * for timestamps, the text itself otherwise.
     *
     * @throws IllegalArgumentException if the literal cannot represent a value of this type
     */
    public Object coerce(Object literal) {
        if (literal == null) {
            return null;
        }
        return switch (this) {
            case TEXT -> literal.toString();
            case INTEGER, NUMERIC -> literal instanceof BigDecimal number ? number : parseNumber(literal.toString());
            case TIMESTAMP -> parseTimestamp(literal.toString());
        };
    }

    /**
     * Normalizes a value read from a {@link Trip} into the same representation
     * {@link #coerce(Object)} produces.
     */
    public Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (isNumeric()) {
            return Numbers.toBigDecimal(value);
        }
        return value;
    }

    private static BigDecimal parseNumber(String text) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + text + "' is not a number", e);
        }
    }

    private static LocalDateTime parseTimestamp(String text) {
        String trimmed = text.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay();
            }
            return LocalDateTime.parse(trimmed.replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("'" + text + "' is not a timestamp", e);
        }
    }
}

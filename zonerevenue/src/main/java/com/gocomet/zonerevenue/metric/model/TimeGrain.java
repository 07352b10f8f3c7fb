package com.gocomet.zonerevenue.metric.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Arrays;
import java.util.Optional;

public enum TimeGrain {
    DAY,
    WEEK,
    MONTH,
    QUARTER,
    YEAR;

    /**
     * Start of the bucket the timestamp falls in. Weeks start on Monday.
     */
    public LocalDate truncate(LocalDateTime timestamp) {
        LocalDate date = timestamp.toLocalDate();
        return switch (this) {
            case DAY -> date;
            case WEEK -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> date.withDayOfMonth(1);
            case QUARTER -> LocalDate.of(date.getYear(), date.getMonth().firstMonthOfQuarter(), 1);
            case YEAR -> date.withDayOfYear(1);
        };
    }

    public String label() {
        return name().toLowerCase();
    }

    public static Optional<TimeGrain> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(grain -> grain.name().equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}

package com.gocomet.zonerevenue.aggregation.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * Grouping key shared by the statistics and revenue tables. Any component may
 * be null; null components group together, as in SQL.
 */
@Value
public class ZoneMonthKey {

    public static final Comparator<ZoneMonthKey> ORDER = Comparator
            .comparing(ZoneMonthKey::getRevenueZone, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(ZoneMonthKey::getRevenueMonth, Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(ZoneMonthKey::getServiceType, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    String revenueZone;
    LocalDate revenueMonth;
    String serviceType;
}

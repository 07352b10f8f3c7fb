package com.gocomet.zonerevenue.aggregation.service;

import com.gocomet.zonerevenue.aggregation.config.AggregationProperties;
import com.gocomet.zonerevenue.aggregation.model.ZoneMonthKey;
import com.gocomet.zonerevenue.trip.model.Trip;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Extracts the (pickup zone, pickup month, service type) key and partitions
 * trips by it. Both derived tables group through this class.
 */
@Component
@RequiredArgsConstructor
public class ZoneMonthGrouping {

    private final AggregationProperties properties;

    public ZoneMonthKey keyOf(Trip trip) {
        return new ZoneMonthKey(trip.getPickupZone(), monthOf(trip.getPickupDatetime()), trip.getServiceType());
    }

    /**
     * First day of the calendar month the timestamp falls in, or {@code null}
     * for a null timestamp.
     */
    public LocalDate monthOf(LocalDateTime timestamp) {
        if (timestamp == null) {
            return null;
        }
        LocalDateTime local = timestamp;
        if (properties.convertsTimeZone()) {
            local = timestamp.atZone(properties.getSourceTimeZone())
                    .withZoneSameInstant(properties.getBucketTimeZone())
                    .toLocalDateTime();
        }
        return local.toLocalDate().withDayOfMonth(1);
    }

    /**
     * Folds every trip into the accumulator of its group. Only keys with at
     * least one trip are present; iteration follows {@link ZoneMonthKey#ORDER}.
     */
    public <A> Map<ZoneMonthKey, A> group(Collection<Trip> trips, Supplier<A> newGroup, BiConsumer<A, Trip> fold) {
        Map<ZoneMonthKey, A> groups = new TreeMap<>(ZoneMonthKey.ORDER);
        for (Trip trip : trips) {
            A accumulator = groups.computeIfAbsent(keyOf(trip), key -> newGroup.get());
            fold.accept(accumulator, trip);
        }
        return groups;
    }
}

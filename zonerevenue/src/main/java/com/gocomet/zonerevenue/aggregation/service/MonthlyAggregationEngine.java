package com.gocomet.zonerevenue.aggregation.service;

import com.gocomet.zonerevenue.aggregation.model.MonthlyZoneRevenue;
import com.gocomet.zonerevenue.aggregation.model.MonthlyZoneStatistic;
import com.gocomet.zonerevenue.aggregation.model.ZoneMonthKey;
import com.gocomet.zonerevenue.common.aggregate.DecimalAverage;
import com.gocomet.zonerevenue.common.aggregate.DecimalSum;
import com.gocomet.zonerevenue.common.aggregate.NonNullCount;
import com.gocomet.zonerevenue.trip.model.Trip;
import com.gocomet.zonerevenue.trip.model.TripColumn;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Monthly per-zone rollups of the trip fact table. Both operations are pure:
 * same trips in, same rows out, in {@link ZoneMonthKey#ORDER}.
 */
@Component
@RequiredArgsConstructor
public class MonthlyAggregationEngine {

    /** Columns either rollup reads. */
    public static final List<TripColumn> REQUIRED_COLUMNS = List.of(
            TripColumn.TRIPID,
            TripColumn.PICKUP_ZONE,
            TripColumn.PICKUP_DATETIME,
            TripColumn.SERVICE_TYPE,
            TripColumn.PASSENGER_COUNT,
            TripColumn.TRIP_DISTANCE,
            TripColumn.FARE_AMOUNT,
            TripColumn.EXTRA,
            TripColumn.MTA_TAX,
            TripColumn.TIP_AMOUNT,
            TripColumn.TOLLS_AMOUNT,
            TripColumn.EHAIL_FEE,
            TripColumn.IMPROVEMENT_SURCHARGE,
            TripColumn.TOTAL_AMOUNT,
            TripColumn.CONGESTION_SURCHARGE);

    private final ZoneMonthGrouping grouping;

    /**
     * Trip count, average passenger count and average trip distance per group.
     */
    public List<MonthlyZoneStatistic> computeStatistics(Collection<Trip> trips) {
        Map<ZoneMonthKey, StatisticGroup> groups = grouping.group(trips, StatisticGroup::new, StatisticGroup::add);
        return groups.entrySet().stream()
                .map(entry -> entry.getValue().toRow(entry.getKey()))
                .toList();
    }

    /**
     * Sum of each of the nine charge columns per group.
     */
    public List<MonthlyZoneRevenue> computeRevenue(Collection<Trip> trips) {
        Map<ZoneMonthKey, RevenueGroup> groups = grouping.group(trips, RevenueGroup::new, RevenueGroup::add);
        return groups.entrySet().stream()
                .map(entry -> entry.getValue().toRow(entry.getKey()))
                .toList();
    }

    private static final class StatisticGroup {
        private final NonNullCount trips = new NonNullCount();
        private final DecimalAverage passengerCount = new DecimalAverage();
        private final DecimalAverage tripDistance = new DecimalAverage();

        void add(Trip trip) {
            trips.add(trip.getTripId());
            passengerCount.add(trip.getPassengerCount());
            tripDistance.add(trip.getTripDistance());
        }

        MonthlyZoneStatistic toRow(ZoneMonthKey key) {
            return MonthlyZoneStatistic.builder()
                    .revenueZone(key.getRevenueZone())
                    .revenueMonth(key.getRevenueMonth())
                    .serviceType(key.getServiceType())
                    .totalMonthlyTrips(trips.result())
                    .avgMonthlyPassengerCount(passengerCount.doubleResult())
                    .avgMonthlyTripDistance(tripDistance.doubleResult())
                    .build();
        }
    }

    private static final class RevenueGroup {
        private final DecimalSum fare = new DecimalSum();
        private final DecimalSum extra = new DecimalSum();
        private final DecimalSum mtaTax = new DecimalSum();
        private final DecimalSum tipAmount = new DecimalSum();
        private final DecimalSum tollsAmount = new DecimalSum();
        private final DecimalSum ehailFee = new DecimalSum();
        private final DecimalSum improvementSurcharge = new DecimalSum();
        private final DecimalSum totalAmount = new DecimalSum();
        private final DecimalSum congestionSurcharge = new DecimalSum();

        void add(Trip trip) {
            fare.add(trip.getFareAmount());
            extra.add(trip.getExtra());
            mtaTax.add(trip.getMtaTax());
            tipAmount.add(trip.getTipAmount());
            tollsAmount.add(trip.getTollsAmount());
            ehailFee.add(trip.getEhailFee());
            improvementSurcharge.add(trip.getImprovementSurcharge());
            totalAmount.add(trip.getTotalAmount());
            congestionSurcharge.add(trip.getCongestionSurcharge());
        }

        MonthlyZoneRevenue toRow(ZoneMonthKey key) {
            return MonthlyZoneRevenue.builder()
                    .revenueZone(key.getRevenueZone())
                    .revenueMonth(key.getRevenueMonth())
                    .serviceType(key.getServiceType())
                    .revenueMonthlyFare(fare.result())
                    .revenueMonthlyExtra(extra.result())
                    .revenueMonthlyMtaTax(mtaTax.result())
                    .revenueMonthlyTipAmount(tipAmount.result())
                    .revenueMonthlyTollsAmount(tollsAmount.result())
                    .revenueMonthlyEhailFee(ehailFee.result())
                    .revenueMonthlyImprovementSurcharge(improvementSurcharge.result())
                    .revenueMonthlyTotalAmount(totalAmount.result())
                    .revenueMonthlyCongestionSurcharge(congestionSurcharge.result())
                    .build();
        }
    }
}

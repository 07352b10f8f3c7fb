package com.gocomet.zonerevenue.aggregation.service;

import com.gocomet.zonerevenue.aggregation.config.DataQualityProperties;
import com.gocomet.zonerevenue.aggregation.model.DataQualityWarning;
import com.gocomet.zonerevenue.aggregation.model.DataQualityWarning.Check;
import com.gocomet.zonerevenue.trip.model.Trip;
import com.gocomet.zonerevenue.trip.model.TripColumn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class DataQualityInspector {

    static final List<TripColumn> INSPECTED_COLUMNS = MonthlyAggregationEngine.REQUIRED_COLUMNS.stream()
            .filter(column -> column != TripColumn.TRIPID)
            .toList();

    private static final List<TripColumn> CHARGE_COLUMNS = List.of(
            TripColumn.FARE_AMOUNT,
            TripColumn.EXTRA,
            TripColumn.MTA_TAX,
            TripColumn.TIP_AMOUNT,
            TripColumn.TOLLS_AMOUNT,
            TripColumn.EHAIL_FEE,
            TripColumn.IMPROVEMENT_SURCHARGE,
            TripColumn.CONGESTION_SURCHARGE);

    private final DataQualityProperties properties;

    /**
     * Inspect a snapshot. Every warning is logged; none is thrown.
     */
    public List<DataQualityWarning> inspect(Collection<Trip> trips) {
        List<DataQualityWarning> warnings = new ArrayList<>();
        long total = trips.size();
        if (total == 0) {
            return warnings;
        }

        for (TripColumn column : INSPECTED_COLUMNS) {
            long nulls = trips.stream().filter(trip -> column.read(trip) == null).count();
            double ratio = (double) nulls / total;
            if (ratio > properties.maxNullRatioFor(column.columnName())) {
                warnings.add(warning(Check.NULL_RATIO, column.columnName(), nulls, total,
                        String.format("%d of %d rows have a null %s", nulls, total, column.columnName())));
            }
        }

        long reversed = trips.stream()
                .filter(trip -> trip.getPickupDatetime() != null && trip.getDropoffDatetime() != null)
                .filter(trip -> trip.getPickupDatetime().isAfter(trip.getDropoffDatetime()))
                .count();
        if (reversed > 0) {
            warnings.add(warning(Check.PICKUP_AFTER_DROPOFF, TripColumn.PICKUP_DATETIME.columnName(), reversed, total,
                    String.format("%d trips end before they start", reversed)));
        }

        long mismatched = trips.stream().filter(this::totalAmountMismatch).count();
        if (mismatched > 0) {
            warnings.add(warning(Check.TOTAL_AMOUNT_MISMATCH, TripColumn.TOTAL_AMOUNT.columnName(), mismatched, total,
                    String.format("%d fully itemized trips have a total_amount that differs from their charges",
                            mismatched)));
        }

        warnings.forEach(w -> log.warn("Data quality [{}] {}: {}", w.getCheck(), w.getColumn(), w.getMessage()));
        return warnings;
    }

    private boolean totalAmountMismatch(Trip trip) {
        BigDecimal total = trip.getTotalAmount();
        List<BigDecimal> charges = CHARGE_COLUMNS.stream()
                .map(column -> (BigDecimal) column.read(trip))
                .toList();
        if (total == null || charges.contains(null)) {
            return false;
        }
        BigDecimal itemized = charges.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return itemized.subtract(total).abs().compareTo(properties.getTotalAmountTolerance()) > 0;
    }

    private static DataQualityWarning warning(Check check, String column, long affected, long total, String message) {
        return DataQualityWarning.builder()
                .check(check)
                .column(column)
                .affectedRows(affected)
                .totalRows(total)
                .ratio((double) affected / total)
                .message(message)
                .build();
    }
}

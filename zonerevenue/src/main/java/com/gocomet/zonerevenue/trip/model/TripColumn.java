package com.gocomet.zonerevenue.trip.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Catalogue of readable {@code fact_trips} columns. Metric expressions, filters
 * and schema checks resolve column names through this enum only.
 */
public enum TripColumn {

    TRIPID("tripid", ColumnType.TEXT, Trip::getTripId),
    VENDORID("vendorid", ColumnType.INTEGER, Trip::getVendorId),
    SERVICE_TYPE("service_type", ColumnType.TEXT, Trip::getServiceType),
    RATECODEID("ratecodeid", ColumnType.INTEGER, Trip::getRateCodeId),
    PICKUP_LOCATIONID("pickup_locationid", ColumnType.INTEGER, Trip::getPickupLocationId),
    PICKUP_BOROUGH("pickup_borough", ColumnType.TEXT, Trip::getPickupBorough),
    PICKUP_ZONE("pickup_zone", ColumnType.TEXT, Trip::getPickupZone),
    DROPOFF_LOCATIONID("dropoff_locationid", ColumnType.INTEGER, Trip::getDropoffLocationId),
    DROPOFF_BOROUGH("dropoff_borough", ColumnType.TEXT, Trip::getDropoffBorough),
    DROPOFF_ZONE("dropoff_zone", ColumnType.TEXT, Trip::getDropoffZone),
    PICKUP_DATETIME("pickup_datetime", ColumnType.TIMESTAMP, Trip::getPickupDatetime),
    DROPOFF_DATETIME("dropoff_datetime", ColumnType.TIMESTAMP, Trip::getDropoffDatetime),
    STORE_AND_FWD_FLAG("store_and_fwd_flag", ColumnType.TEXT, Trip::getStoreAndFwdFlag),
    PASSENGER_COUNT("passenger_count", ColumnType.INTEGER, Trip::getPassengerCount),
    TRIP_DISTANCE("trip_distance", ColumnType.NUMERIC, Trip::getTripDistance),
    TRIP_TYPE("trip_type", ColumnType.INTEGER, Trip::getTripType),
    FARE_AMOUNT("fare_amount", ColumnType.NUMERIC, Trip::getFareAmount),
    EXTRA("extra", ColumnType.NUMERIC, Trip::getExtra),
    MTA_TAX("mta_tax", ColumnType.NUMERIC, Trip::getMtaTax),
    TIP_AMOUNT("tip_amount", ColumnType.NUMERIC, Trip::getTipAmount),
    TOLLS_AMOUNT("tolls_amount", ColumnType.NUMERIC, Trip::getTollsAmount),
    EHAIL_FEE("ehail_fee", ColumnType.NUMERIC, Trip::getEhailFee),
    IMPROVEMENT_SURCHARGE("improvement_surcharge", ColumnType.NUMERIC, Trip::getImprovementSurcharge),
    TOTAL_AMOUNT("total_amount", ColumnType.NUMERIC, Trip::getTotalAmount),
    CONGESTION_SURCHARGE("congestion_surcharge", ColumnType.NUMERIC, Trip::getCongestionSurcharge),
    PAYMENT_TYPE("payment_type", ColumnType.INTEGER, Trip::getPaymentType),
    PAYMENT_TYPE_DESCRIPTION("payment_type_description", ColumnType.TEXT, Trip::getPaymentTypeDescription);

    private static final Map<String, TripColumn> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(TripColumn::columnName, Function.identity()));

    private final String columnName;
    private final ColumnType type;
    private final Function<Trip, Object> accessor;

    TripColumn(String columnName, ColumnType type, Function<Trip, Object> accessor) {
        this.columnName = columnName;
        this.type = type;
        this.accessor = accessor;
    }

    public String columnName() {
        return columnName;
    }

    public ColumnType type() {
        return type;
    }

    public Object read(Trip trip) {
        return accessor.apply(trip);
    }

    /**
     * Looks a column up by its SQL name, ignoring case and surrounding whitespace.
     */
    public static Optional<TripColumn> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}

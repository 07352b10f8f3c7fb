package com.gocomet.zonerevenue.trip.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One row of the trip fact table. Zone and borough names are denormalized
 * onto the row upstream, so aggregation never joins back to {@code dim_zones}.
 */
@Entity
@Immutable
@Table(name = "fact_trips", indexes = {
        @Index(name = "idx_fact_trips_pickup_zone", columnList = "pickup_zone"),
        @Index(name = "idx_fact_trips_pickup_datetime", columnList = "pickup_datetime")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Trip {

    @Id
    @Column(name = "tripid")
    private String tripId;

    @Column(name = "vendorid")
    private Integer vendorId;

    @Column(name = "service_type")
    private String serviceType;

    @Column(name = "ratecodeid")
    private Integer rateCodeId;

    @Column(name = "pickup_locationid")
    private Integer pickupLocationId;

    @Column(name = "pickup_borough")
    private String pickupBorough;

    @Column(name = "pickup_zone")
    private String pickupZone;

    @Column(name = "dropoff_locationid")
    private Integer dropoffLocationId;

    @Column(name = "dropoff_borough")
    private String dropoffBorough;

    @Column(name = "dropoff_zone")
    private String dropoffZone;

    @Column(name = "pickup_datetime")
    private LocalDateTime pickupDatetime;

    @Column(name = "dropoff_datetime")
    private LocalDateTime dropoffDatetime;

    @Column(name = "store_and_fwd_flag")
    private String storeAndFwdFlag;

    @Column(name = "passenger_count")
    private Integer passengerCount;

    @Column(name = "trip_distance")
    private Double tripDistance;

    @Column(name = "trip_type")
    private Integer tripType;

    // Charges
    @Column(name = "fare_amount", precision = 10, scale = 2)
    private BigDecimal fareAmount;

    @Column(name = "extra", precision = 10, scale = 2)
    private BigDecimal extra;

    @Column(name = "mta_tax", precision = 10, scale = 2)
    private BigDecimal mtaTax;

    @Column(name = "tip_amount", precision = 10, scale = 2)
    private BigDecimal tipAmount;

    @Column(name = "tolls_amount", precision = 10, scale = 2)
    private BigDecimal tollsAmount;

    @Column(name = "ehail_fee", precision = 10, scale = 2)
    private BigDecimal ehailFee;

    @Column(name = "improvement_surcharge", precision = 10, scale = 2)
    private BigDecimal improvementSurcharge;

    @Column(name = "total_amount", precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "congestion_surcharge", precision = 10, scale = 2)
    private BigDecimal congestionSurcharge;

    @Column(name = "payment_type")
    private Integer paymentType;

    @Column(name = "payment_type_description")
    private String paymentTypeDescription;
}

package com.gocomet.zonerevenue.aggregation.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "dm_monthly_zone_statistics", indexes = {
        @Index(name = "idx_zone_statistics_key", columnList = "revenue_zone, revenue_month, service_type")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonthlyZoneStatistic {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "revenue_zone")
    private String revenueZone;

    @Column(name = "revenue_month")
    private LocalDate revenueMonth;

    @Column(name = "service_type")
    private String serviceType;

    @Column(name = "total_monthly_trips", nullable = false)
    private Long totalMonthlyTrips;

    // Column names keep the published table's spelling
    @Column(name = "avg_montly_passenger_count")
    private Double avgMonthlyPassengerCount;

    @Column(name = "avg_montly_trip_distance")
    private Double avgMonthlyTripDistance;

    public ZoneMonthKey key() {
        return new ZoneMonthKey(revenueZone, revenueMonth, serviceType);
    }
}

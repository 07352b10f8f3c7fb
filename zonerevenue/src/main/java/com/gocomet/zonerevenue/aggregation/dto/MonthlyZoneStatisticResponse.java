package com.gocomet.zonerevenue.aggregation.dto;

import lombok.*;

import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonthlyZoneStatisticResponse {

    private String revenueZone;
    private LocalDate revenueMonth;
    private String serviceType;
    private Long totalMonthlyTrips;
    private Double avgMonthlyPassengerCount;
    private Double avgMonthlyTripDistance;
}

package com.gocomet.zonerevenue.aggregation.dto;

import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonthlyZoneRevenueResponse {

    private String revenueZone;
    private LocalDate revenueMonth;
    private String serviceType;
    private BigDecimal revenueMonthlyFare;
    private BigDecimal revenueMonthlyExtra;
    private BigDecimal revenueMonthlyMtaTax;
    private BigDecimal revenueMonthlyTipAmount;
    private BigDecimal revenueMonthlyTollsAmount;
    private BigDecimal revenueMonthlyEhailFee;
    private BigDecimal revenueMonthlyImprovementSurcharge;
    private BigDecimal revenueMonthlyTotalAmount;
    private BigDecimal revenueMonthlyCongestionSurcharge;
}

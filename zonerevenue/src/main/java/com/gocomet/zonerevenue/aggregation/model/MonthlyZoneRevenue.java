package com.gocomet.zonerevenue.aggregation.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "dm_monthly_zone_revenue", indexes = {
        @Index(name = "idx_zone_revenue_key", columnList = "revenue_zone, revenue_month, service_type")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonthlyZoneRevenue {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "revenue_zone")
    private String revenueZone;

    @Column(name = "revenue_month")
    private LocalDate revenueMonth;

    @Column(name = "service_type")
    private String serviceType;

    @Column(name = "revenue_monthly_fare", precision = 14, scale = 2)
    private BigDecimal revenueMonthlyFare;

    @Column(name = "revenue_monthly_extra", precision = 14, scale = 2)
    private BigDecimal revenueMonthlyExtra;

    @Column(name = "revenue_monthly_mta_tax", precision = 14, scale = 2)
    private BigDecimal revenueMonthlyMtaTax;

    @Column(name = "revenue_monthly_tip_amount", precision = 14, scale = 2)
    private BigDecimal revenueMonthlyTipAmount;

    @Column(name = "revenue_monthly_tolls_amount", precision = 14, scale = 2)
    private BigDecimal revenueMonthlyTollsAmount;

    @Column(name = "revenue_monthly_ehail_fee", precision = 14, scale = 2)
    private BigDecimal revenueMonthlyEhailFee;

    @Column(name = "revenue_monthly_improvement_surcharge", precision = 14, scale = 2)
    private BigDecimal revenueMonthlyImprovementSurcharge;

    @Column(name = "revenue_monthly_total_amount", precision = 14, scale = 2)
    private BigDecimal revenueMonthlyTotalAmount;

    @Column(name = "revenue_monthly_congestion_surcharge", precision = 14, scale = 2)
    private BigDecimal revenueMonthlyCongestionSurcharge;

    public ZoneMonthKey key() {
        return new ZoneMonthKey(revenueZone, revenueMonth, serviceType);
    }
}

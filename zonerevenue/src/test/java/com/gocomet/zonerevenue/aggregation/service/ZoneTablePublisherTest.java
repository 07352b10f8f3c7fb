package com.gocomet.zonerevenue.aggregation.service;

import com.gocomet.zonerevenue.aggregation.model.MonthlyZoneRevenue;
import com.gocomet.zonerevenue.aggregation.model.MonthlyZoneStatistic;
import com.gocomet.zonerevenue.aggregation.repository.MonthlyZoneRevenueRepository;
import com.gocomet.zonerevenue.aggregation.repository.MonthlyZoneStatisticRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(ZoneTablePublisher.class)
class ZoneTablePublisherTest {

    private static final LocalDate JANUARY = LocalDate.of(2019, 1, 1);
    private static final LocalDate FEBRUARY = LocalDate.of(2019, 2, 1);
    private static final Sort KEY_ORDER = Sort.by("revenueZone", "revenueMonth", "serviceType");

    @Autowired
    private ZoneTablePublisher publisher;

    @Autowired
    private MonthlyZoneStatisticRepository statisticRepository;

    @Autowired
    private MonthlyZoneRevenueRepository revenueRepository;

    @Test
    void replacesPreviousRowsOfBothTables() {
        publisher.publish(
                List.of(statistic("Midtown", JANUARY, "yellow", 10L), statistic("Astoria", JANUARY, "green", 4L)),
                List.of(revenue("Midtown", JANUARY, "yellow", "158.00")));

        publisher.publish(
                List.of(statistic("Midtown", FEBRUARY, "yellow", 3L)),
                List.of(revenue("Midtown", FEBRUARY, "yellow", "47.40")));

        assertThat(statisticRepository.findAll())
                .singleElement()
                .satisfies(row -> {
                    assertThat(row.getRevenueMonth()).isEqualTo(FEBRUARY);
                    assertThat(row.getTotalMonthlyTrips()).isEqualTo(3L);
                });
        assertThat(revenueRepository.findAll())
                .singleElement()
                .satisfies(row -> assertThat(row.getRevenueMonthlyTotalAmount()).isEqualByComparingTo("47.40"));
    }

    @Test
    void publishingEmptyResultsClearsBothTables() {
        publisher.publish(List.of(statistic("Midtown", JANUARY, "yellow", 1L)),
                List.of(revenue("Midtown", JANUARY, "yellow", "15.80")));

        publisher.publish(List.of(), List.of());

        assertThat(statisticRepository.count()).isZero();
        assertThat(revenueRepository.count()).isZero();
    }

    @Test
    void findersFilterByZoneAndServiceType() {
        publisher.publish(
                List.of(statistic("Midtown", FEBRUARY, "yellow", 2L),
                        statistic("Midtown", JANUARY, "yellow", 5L),
                        statistic("Midtown", JANUARY, "green", 1L),
                        statistic("Astoria", JANUARY, "green", 7L)),
                List.of(revenue("Midtown", JANUARY, "yellow", "10.00"),
                        revenue("Astoria", JANUARY, "green", "20.00")));

        assertThat(statisticRepository.findAll(KEY_ORDER)).hasSize(4);
        assertThat(statisticRepository.findByRevenueZoneAndServiceType("Midtown", "yellow", KEY_ORDER))
                .extracting(MonthlyZoneStatistic::getRevenueMonth)
                .containsExactly(JANUARY, FEBRUARY);
        assertThat(statisticRepository.findByServiceType("green", KEY_ORDER))
                .extracting(MonthlyZoneStatistic::getRevenueZone)
                .containsExactly("Astoria", "Midtown");
        assertThat(revenueRepository.findByRevenueZone("Astoria", KEY_ORDER))
                .extracting(MonthlyZoneRevenue::getServiceType)
                .containsExactly("green");
    }

    private static MonthlyZoneStatistic statistic(String zone, LocalDate month, String serviceType, long trips) {
        return MonthlyZoneStatistic.builder()
                .revenueZone(zone)
                .revenueMonth(month)
                .serviceType(serviceType)
                .totalMonthlyTrips(trips)
                .avgMonthlyPassengerCount(1.5)
                .avgMonthlyTripDistance(2.0)
                .build();
    }

    private static MonthlyZoneRevenue revenue(String zone, LocalDate month, String serviceType, String total) {
        return MonthlyZoneRevenue.builder()
                .revenueZone(zone)
                .revenueMonth(month)
                .serviceType(serviceType)
                .revenueMonthlyTotalAmount(new BigDecimal(total))
                .build();
    }
}

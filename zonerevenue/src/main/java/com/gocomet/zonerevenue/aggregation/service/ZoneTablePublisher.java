package com.gocomet.zonerevenue.aggregation.service;

import com.gocomet.zonerevenue.aggregation.model.MonthlyZoneRevenue;
import com.gocomet.zonerevenue.aggregation.model.MonthlyZoneStatistic;
import com.gocomet.zonerevenue.aggregation.repository.MonthlyZoneRevenueRepository;
import com.gocomet.zonerevenue.aggregation.repository.MonthlyZoneStatisticRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Replaces both derived tables in a single transaction. Readers see either the
 * previous pair of tables or the new pair, never a mix.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ZoneTablePublisher {

    private final MonthlyZoneStatisticRepository statisticRepository;
    private final MonthlyZoneRevenueRepository revenueRepository;

    @Transactional
    public void publish(List<MonthlyZoneStatistic> statistics, List<MonthlyZoneRevenue> revenue) {
        statisticRepository.deleteAllInBatch();
        revenueRepository.deleteAllInBatch();
        statisticRepository.saveAll(statistics);
        revenueRepository.saveAll(revenue);
        log.info("Published {} statistic rows and {} revenue rows", statistics.size(), revenue.size());
    }
}

package com.gocomet.zonerevenue.aggregation.repository;

import com.gocomet.zonerevenue.aggregation.model.MonthlyZoneStatistic;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MonthlyZoneStatisticRepository extends JpaRepository<MonthlyZoneStatistic, UUID> {

    List<MonthlyZoneStatistic> findByRevenueZone(String revenueZone, Sort sort);

    List<MonthlyZoneStatistic> findByServiceType(String serviceType, Sort sort);

    List<MonthlyZoneStatistic> findByRevenueZoneAndServiceType(String revenueZone, String serviceType, Sort sort);
}

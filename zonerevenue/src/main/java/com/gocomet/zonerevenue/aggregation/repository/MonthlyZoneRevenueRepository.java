package com.gocomet.zonerevenue.aggregation.repository;

import com.gocomet.zonerevenue.aggregation.model.MonthlyZoneRevenue;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MonthlyZoneRevenueRepository extends JpaRepository<MonthlyZoneRevenue, UUID> {

    List<MonthlyZoneRevenue> findByRevenueZone(String revenueZone, Sort sort);

    List<MonthlyZoneRevenue> findByServiceType(String serviceType, Sort sort);

    List<MonthlyZoneRevenue> findByRevenueZoneAndServiceType(String revenueZone, String serviceType, Sort sort);
}

package com.gocomet.zonerevenue.zone.repository;

import com.gocomet.zonerevenue.zone.model.Zone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ZoneRepository extends JpaRepository<Zone, Integer> {
    List<Zone> findByBoroughOrderByLocationId(String borough);
}

package com.gocomet.zonerevenue.trip.repository;

import com.gocomet.zonerevenue.trip.model.Trip;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TripRepository extends JpaRepository<Trip, String> {
}

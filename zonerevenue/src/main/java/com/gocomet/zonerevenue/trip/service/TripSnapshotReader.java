package com.gocomet.zonerevenue.trip.service;

import com.gocomet.zonerevenue.trip.model.Trip;
import com.gocomet.zonerevenue.trip.repository.TripRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Reads the whole fact table in one read-only transaction so every consumer of
 * the returned list observes the same snapshot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripSnapshotReader {

    private final TripRepository tripRepository;

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<Trip> readSnapshot() {
        List<Trip> trips = List.copyOf(tripRepository.findAll());
        log.info("Read trip snapshot of {} rows", trips.size());
        return trips;
    }
}

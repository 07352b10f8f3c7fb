package com.gocomet.zonerevenue.common.config;

import com.gocomet.zonerevenue.trip.model.Trip;
import com.gocomet.zonerevenue.trip.repository.TripRepository;
import com.gocomet.zonerevenue.zone.model.Zone;
import com.gocomet.zonerevenue.zone.repository.ZoneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Seeds a few zones and trips for local development.
 * Uses real NYC taxi zone ids so the data lines up with the zone lookup.
 */
@Component
@ConditionalOnProperty(prefix = "app.seed", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DataSeeder implements CommandLineRunner {

    private final ZoneRepository zoneRepository;
    private final TripRepository tripRepository;

    @Override
    public void run(String... args) {
        if (tripRepository.count() > 0) {
            log.info("Database already seeded. Skipping.");
            return;
        }

        log.info("Seeding database with test data...");

        Zone midtown = zoneRepository.save(Zone.builder()
                .locationId(161).borough("Manhattan").zone("Midtown Center").serviceZone("Yellow Zone").build());
        Zone upperEast = zoneRepository.save(Zone.builder()
                .locationId(236).borough("Manhattan").zone("Upper East Side North").serviceZone("Yellow Zone").build());
        Zone jfk = zoneRepository.save(Zone.builder()
                .locationId(132).borough("Queens").zone("JFK Airport").serviceZone("Airports").build());

        tripRepository.saveAll(List.of(
                trip("seed-0001", "Yellow", midtown, upperEast, LocalDateTime.of(2019, 1, 5, 8, 15), 25, 1, 2.4,
                        "11.00", "2.00", "0.00"),
                trip("seed-0002", "Yellow", midtown, jfk, LocalDateTime.of(2019, 1, 20, 17, 40), 55, null, 17.8,
                        "52.00", "10.00", "5.76"),
                trip("seed-0003", "Green", upperEast, midtown, LocalDateTime.of(2019, 2, 2, 23, 5), 18, 2, 3.1,
                        "13.50", "0.00", "0.00"),
                trip("seed-0004", "Yellow", jfk, midtown, LocalDateTime.of(2019, 4, 11, 6, 30), 48, 3, 18.2,
                        "52.00", "11.00", "5.76"),
                trip("seed-0005", "Yellow", upperEast, upperEast, LocalDateTime.of(2019, 4, 28, 12, 0), 9, 1, 0.9,
                        "6.50", "1.00", "0.00")));

        log.info("Seeded {} zones and {} trips", zoneRepository.count(), tripRepository.count());
    }

    private static Trip trip(String id, String serviceType, Zone pickup, Zone dropoff, LocalDateTime pickupAt,
                             int minutes, Integer passengers, double distance,
                             String fare, String tip, String tolls) {
        BigDecimal extra = new BigDecimal("0.50");
        BigDecimal mtaTax = new BigDecimal("0.50");
        BigDecimal improvement = new BigDecimal("0.30");
        BigDecimal congestion = "Yellow".equals(serviceType) ? new BigDecimal("2.50") : BigDecimal.ZERO;
        BigDecimal total = new BigDecimal(fare).add(extra).add(mtaTax).add(new BigDecimal(tip))
                .add(new BigDecimal(tolls)).add(improvement).add(congestion);

        return Trip.builder()
                .tripId(id)
                .vendorId(2)
                .serviceType(serviceType)
                .rateCodeId(1)
                .pickupLocationId(pickup.getLocationId())
                .pickupBorough(pickup.getBorough())
                .pickupZone(pickup.getZone())
                .dropoffLocationId(dropoff.getLocationId())
                .dropoffBorough(dropoff.getBorough())
                .dropoffZone(dropoff.getZone())
                .pickupDatetime(pickupAt)
                .dropoffDatetime(pickupAt.plusMinutes(minutes))
                .storeAndFwdFlag("N")
                .passengerCount(passengers)
                .tripDistance(distance)
                .tripType(1)
                .fareAmount(new BigDecimal(fare))
                .extra(extra)
                .mtaTax(mtaTax)
                .tipAmount(new BigDecimal(tip))
                .tollsAmount(new BigDecimal(tolls))
                .improvementSurcharge(improvement)
                .totalAmount(total)
                .congestionSurcharge(congestion)
                .paymentType(1)
                .paymentTypeDescription("Credit card")
                .build();
    }
}

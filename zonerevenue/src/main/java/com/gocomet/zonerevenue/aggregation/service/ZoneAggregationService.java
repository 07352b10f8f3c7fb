package com.gocomet.zonerevenue.aggregation.service;

import com.gocomet.zonerevenue.aggregation.dto.AggregationRunResponse;
import com.gocomet.zonerevenue.aggregation.dto.MonthlyZoneRevenueResponse;
import com.gocomet.zonerevenue.aggregation.dto.MonthlyZoneStatisticResponse;
import com.gocomet.zonerevenue.aggregation.event.AggregationEvent;
import com.gocomet.zonerevenue.aggregation.event.AggregationEventProducer;
import com.gocomet.zonerevenue.aggregation.model.DataQualityWarning;
import com.gocomet.zonerevenue.aggregation.model.MonthlyZoneRevenue;
import com.gocomet.zonerevenue.aggregation.model.MonthlyZoneStatistic;
import com.gocomet.zonerevenue.aggregation.repository.MonthlyZoneRevenueRepository;
import com.gocomet.zonerevenue.aggregation.repository.MonthlyZoneStatisticRepository;
import com.gocomet.zonerevenue.trip.model.Trip;
import com.gocomet.zonerevenue.trip.service.TripSchemaValidator;
import com.gocomet.zonerevenue.trip.service.TripSnapshotReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Service
@RequiredArgsConstructor
@Slf4j
public class ZoneAggregationService {

    private static final Sort KEY_ORDER = Sort.by("revenueZone", "revenueMonth", "serviceType");

    private final TripSchemaValidator schemaValidator;
    private final TripSnapshotReader snapshotReader;
    private final MonthlyAggregationEngine aggregationEngine;
    private final DataQualityInspector dataQualityInspector;
    private final ZoneTablePublisher tablePublisher;
    private final AggregationEventProducer eventProducer;
    private final MonthlyZoneStatisticRepository statisticRepository;
    private final MonthlyZoneRevenueRepository revenueRepository;
    private final TaskExecutor taskExecutor;

    /**
     * Rebuild both monthly zone tables from the current fact table.
     * 1. Validate the fact table schema
     * 2. Read one snapshot of all trips
     * 3. Compute statistics and revenue concurrently over that snapshot
     * 4. Inspect data quality (warnings only)
     * 5. Replace both tables in one transaction
     * 6. Publish the run outcome to Kafka
     *
     * Any failure up to step 5 leaves the previously published tables in place
     * and is rethrown unchanged. Step 6 runs only after the commit; a failed send
     * is logged and does not fail the run.
     */
    public AggregationRunResponse refresh() {
        UUID runId = UUID.randomUUID();
        Instant startedAt = Instant.now();
        log.info("Aggregation run {} started", runId);

        List<Trip> snapshot;
        List<MonthlyZoneStatistic> statisticRows;
        List<MonthlyZoneRevenue> revenueRows;
        List<DataQualityWarning> warnings;
        try {
            schemaValidator.validate(MonthlyAggregationEngine.REQUIRED_COLUMNS);
            snapshot = snapshotReader.readSnapshot();

            CompletableFuture<List<MonthlyZoneStatistic>> statistics = CompletableFuture.supplyAsync(
                    () -> aggregationEngine.computeStatistics(snapshot), taskExecutor);
            CompletableFuture<List<MonthlyZoneRevenue>> revenue = CompletableFuture.supplyAsync(
                    () -> aggregationEngine.computeRevenue(snapshot), taskExecutor);
            warnings = dataQualityInspector.inspect(snapshot);

            statisticRows = join(statistics);
            revenueRows = join(revenue);
            tablePublisher.publish(statisticRows, revenueRows);
        } catch (RuntimeException e) {
            log.error("Aggregation run {} aborted, previous tables kept", runId, e);
            try {
                eventProducer.publish(AggregationEvent.failed(runId, e.getMessage()));
            } catch (RuntimeException sendFailure) {
                log.error("Could not announce failure of run {}", runId, sendFailure);
                e.addSuppressed(sendFailure);
            }
            throw e;
        }

        log.info("Aggregation run {} finished: {} trips → {} statistic rows, {} revenue rows, {} warnings",
                runId, snapshot.size(), statisticRows.size(), revenueRows.size(), warnings.size());
        try {
            eventProducer.publish(AggregationEvent.published(
                    runId, snapshot.size(), statisticRows.size(), revenueRows.size(), warnings.size()));
        } catch (RuntimeException sendFailure) {
            log.error("Run {} published its tables but the event could not be sent", runId, sendFailure);
        }

        return AggregationRunResponse.builder()
                .runId(runId)
                .startedAt(startedAt)
                .finishedAt(Instant.now())
                .tripCount(snapshot.size())
                .statisticRows(statisticRows.size())
                .revenueRows(revenueRows.size())
                .warnings(warnings)
                .build();
    }

    @Transactional(readOnly = true)
    public List<MonthlyZoneStatisticResponse> getStatistics(String zone, String serviceType) {
        List<MonthlyZoneStatistic> rows;
        if (zone != null && serviceType != null) {
            rows = statisticRepository.findByRevenueZoneAndServiceType(zone, serviceType, KEY_ORDER);
        } else if (zone != null) {
            rows = statisticRepository.findByRevenueZone(zone, KEY_ORDER);
        } else if (serviceType != null) {
            rows = statisticRepository.findByServiceType(serviceType, KEY_ORDER);
        } else {
            rows = statisticRepository.findAll(KEY_ORDER);
        }
        return rows.stream().map(this::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public List<MonthlyZoneRevenueResponse> getRevenue(String zone, String serviceType) {
        List<MonthlyZoneRevenue> rows;
        if (zone != null && serviceType != null) {
            rows = revenueRepository.findByRevenueZoneAndServiceType(zone, serviceType, KEY_ORDER);
        } else if (zone != null) {
            rows = revenueRepository.findByRevenueZone(zone, KEY_ORDER);
        } else if (serviceType != null) {
            rows = revenueRepository.findByServiceType(serviceType, KEY_ORDER);
        } else {
            rows = revenueRepository.findAll(KEY_ORDER);
        }
        return rows.stream().map(this::toResponse).toList();
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private MonthlyZoneStatisticResponse toResponse(MonthlyZoneStatistic row) {
        return MonthlyZoneStatisticResponse.builder()
                .revenueZone(row.getRevenueZone())
                .revenueMonth(row.getRevenueMonth())
                .serviceType(row.getServiceType())
                .totalMonthlyTrips(row.getTotalMonthlyTrips())
                .avgMonthlyPassengerCount(row.getAvgMonthlyPassengerCount())
                .avgMonthlyTripDistance(row.getAvgMonthlyTripDistance())
                .build();
    }

    private MonthlyZoneRevenueResponse toResponse(MonthlyZoneRevenue row) {
        return MonthlyZoneRevenueResponse.builder()
                .revenueZone(row.getRevenueZone())
                .revenueMonth(row.getRevenueMonth())
                .serviceType(row.getServiceType())
                .revenueMonthlyFare(row.getRevenueMonthlyFare())
                .revenueMonthlyExtra(row.getRevenueMonthlyExtra())
                .revenueMonthlyMtaTax(row.getRevenueMonthlyMtaTax())
                .revenueMonthlyTipAmount(row.getRevenueMonthlyTipAmount())
                .revenueMonthlyTollsAmount(row.getRevenueMonthlyTollsAmount())
                .revenueMonthlyEhailFee(row.getRevenueMonthlyEhailFee())
                .revenueMonthlyImprovementSurcharge(row.getRevenueMonthlyImprovementSurcharge())
                .revenueMonthlyTotalAmount(row.getRevenueMonthlyTotalAmount())
                .revenueMonthlyCongestionSurcharge(row.getRevenueMonthlyCongestionSurcharge())
                .build();
    }
}

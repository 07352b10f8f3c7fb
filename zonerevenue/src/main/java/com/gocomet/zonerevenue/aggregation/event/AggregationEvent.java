package com.gocomet.zonerevenue.aggregation.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of one monthly zone aggregation run.
 *
 * Published to the "zone-aggregation-events" Kafka topic, keyed by runId, so
 * report builders can pick up freshly published tables.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationEvent {

    private UUID runId;
    private EventType eventType;
    private Instant timestamp;
    private long tripCount;
    private int statisticRows;
    private int revenueRows;
    private int warningCount;
    private String error; // FAILED only

    public enum EventType {
        ZONE_TABLES_PUBLISHED,
        ZONE_TABLES_FAILED
    }

    // ── Factory helpers ────────────────────────────────────────────────────

    public static AggregationEvent published(UUID runId, long tripCount, int statisticRows, int revenueRows,
                                             int warningCount) {
        return AggregationEvent.builder()
                .runId(runId)
                .eventType(EventType.ZONE_TABLES_PUBLISHED)
                .timestamp(Instant.now())
                .tripCount(tripCount)
                .statisticRows(statisticRows)
                .revenueRows(revenueRows)
                .warningCount(warningCount)
                .build();
    }

    public static AggregationEvent failed(UUID runId, String error) {
        return AggregationEvent.builder()
                .runId(runId)
                .eventType(EventType.ZONE_TABLES_FAILED)
                .timestamp(Instant.now())
                .error(error)
                .build();
    }
}

package com.gocomet.zonerevenue.aggregation.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Audit trail of aggregation runs.
 *
 * Consumer group: "zone-aggregation-audit"
 */
@Service
@Slf4j
public class AggregationEventConsumer {

    @KafkaListener(topics = "${app.kafka.topics.aggregation-events}", groupId = "zone-aggregation-audit")
    public void consume(
            @Payload AggregationEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset) {

        switch (event.getEventType()) {
            case ZONE_TABLES_PUBLISHED -> log.info(
                    "AggregationEvent run={} published {} statistic / {} revenue rows from {} trips ({} warnings) | partition={}, offset={}",
                    event.getRunId(), event.getStatisticRows(), event.getRevenueRows(), event.getTripCount(),
                    event.getWarningCount(), partition, offset);
            case ZONE_TABLES_FAILED -> log.warn("AggregationEvent run={} failed: {} | partition={}, offset={}",
                    event.getRunId(), event.getError(), partition, offset);
        }
    }
}

package com.gocomet.zonerevenue.aggregation.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes aggregation run outcomes. Sending is asynchronous; a failed send is
 * logged and does not affect the already committed tables.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregationEventProducer {

    private final KafkaTemplate<String, AggregationEvent> kafkaTemplate;

    @Value("${app.kafka.topics.aggregation-events}")
    private String topic;

    public void publish(AggregationEvent event) {
        String key = event.getRunId().toString();
        kafkaTemplate.send(topic, key, event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish AggregationEvent [{}] for run {}",
                                event.getEventType(), event.getRunId(), ex);
                    } else {
                        log.info("Published AggregationEvent [{}] for run {} → partition {}, offset {}",
                                event.getEventType(),
                                event.getRunId(),
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    }
                });
    }
}

package com.gocomet.zonerevenue.common.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic definitions.
 *
 * zone-aggregation-events — one event per aggregation run; keyed by runId
 *
 * Partition count is 1 for local dev; runs are rare and ordering across runs matters.
 */
@Configuration
public class KafkaConfig {

    @Value("${app.kafka.topics.aggregation-events}")
    private String aggregationEventsTopic;

    @Bean
    public NewTopic aggregationEventsTopic() {
        return TopicBuilder.name(aggregationEventsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}

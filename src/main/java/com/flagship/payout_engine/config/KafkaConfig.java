package com.flagship.payout_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for payout state-change events.
 * Keyed by transaction id, so 3 partitions keep per-payout ordering.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.payout-events:payout-events}")
    private String payoutEventsTopic;

    @Bean
    public NewTopic payoutEventsTopic() {
        return TopicBuilder.name(payoutEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

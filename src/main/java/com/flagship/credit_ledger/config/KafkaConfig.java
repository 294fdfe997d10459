package com.flagship.credit_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the credit events topic when the outbox publisher runs.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.credits:credit-events}")
    private String creditEventsTopic;

    /**
     * Keyed by credit id, so 3 partitions still keep each credit's events in order.
     */
    @Bean
    public NewTopic creditEventsTopic() {
        return TopicBuilder.name(creditEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

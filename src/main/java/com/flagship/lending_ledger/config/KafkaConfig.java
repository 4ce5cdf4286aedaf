package com.flagship.lending_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for loan events. Keys are loan IDs, so partitions preserve per-loan order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.loan-events:loan-events}")
    private String loanEventsTopic;

    @Value("${kafka.topic.loan-events-partitions:3}")
    private int partitions;

    @Bean
    public NewTopic loanEventsTopic() {
        return TopicBuilder.name(loanEventsTopic)
            .partitions(partitions)
            .replicas(1)
            .build();
    }
}

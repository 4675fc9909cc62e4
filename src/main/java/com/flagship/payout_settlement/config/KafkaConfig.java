package com.flagship.payout_settlement.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by the payout service.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.payout-events:payout-events}")
    private String payoutEventsTopic;

    @Value("${kafka.topic.escalations:payout-escalations}")
    private String escalationsTopic;

    /**
     * Lifecycle events, keyed by payment ID.
     */
    @Bean
    public NewTopic payoutEventsTopic() {
        return TopicBuilder.name(payoutEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic escalationsTopic() {
        return TopicBuilder.name(escalationsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}

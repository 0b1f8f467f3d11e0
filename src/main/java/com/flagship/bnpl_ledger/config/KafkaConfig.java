package com.flagship.bnpl_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by the ledger: outbound domain events and inbound payout outcomes.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.events:bnpl-events}")
    private String eventsTopic;

    @Value("${kafka.topic.payout-outcomes:payout-outcomes}")
    private String payoutOutcomesTopic;

    /**
     * Partitioned by aggregate id, so events of one transaction or merchant stay ordered.
     */
    @Bean
    public NewTopic eventsTopic() {
        return TopicBuilder.name(eventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic payoutOutcomesTopic() {
        return TopicBuilder.name(payoutOutcomesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

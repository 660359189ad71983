package com.flagship.general_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:ledger.events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.audit:ledger.audit}")
    private String auditTopic;

    /**
     * Posted, voided and closed events, keyed by entry or period ID.
     */
    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic auditTopic() {
        return TopicBuilder.name(auditTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

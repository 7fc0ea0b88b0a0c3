package com.flagship.missed_call.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration.
 *
 * The billing-alerts topic carries low-balance alerts, reconciliation
 * escalations and magic-link requests relayed from the outbox.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.billing-alerts:billing-alerts}")
    private String billingAlertsTopic;

    /**
     * Keyed by customer id, so 3 partitions keep per-customer ordering.
     */
    @Bean
    public NewTopic billingAlertsTopic() {
        return TopicBuilder.name(billingAlertsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

package com.flagship.supply_chain.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for relayed product events. Only active with the relay enabled,
 * so the service starts without a broker otherwise.
 */
@Configuration
@ConditionalOnProperty(name = "events.relay.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${events.relay.topic:product-events}")
    private String productEventsTopic;

    /**
     * Keyed by product id; 3 partitions for parallel consumers.
     */
    @Bean
    public NewTopic productEventsTopic() {
        return TopicBuilder.name(productEventsTopic)
            .partitions(3)
            .replicas(1)
            .build();
    }
}

package com.flagship.casino_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topic declarations for rank side effects.
 *
 * Rank events are keyed by community, so partitions keep each community's
 * role changes in order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.rank:casino-rank}")
    private String rankTopic;

    @Bean
    public NewTopic rankTopic() {
        return TopicBuilder.name(rankTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

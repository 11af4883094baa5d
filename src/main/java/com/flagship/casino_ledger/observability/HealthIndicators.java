package com.flagship.casino_ledger.observability;

import com.flagship.casino_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks beyond the database one Spring Boot already provides.
 */
public class HealthIndicators {

    /**
     * Unhealthy when rank events pile up unpublished.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the leaderboard cache, so losing it degrades rather
     * than fails the service.
     */
    @Component("leaderboardCacheHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No Redis connection configured")
                        .withDetail("note", "Leaderboards are served from the database")
                        .build();
            }
            try (var connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.down().withDetail("response", result != null ? result : "null").build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Leaderboards are served from the database")
                        .build();
            }
        }
    }

    /**
     * Games never wait on Kafka; while it is away role changes queue in the
     * outbox, so the service reports degraded instead of down.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;
        private final OutboxEventRepository outboxRepository;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate,
                                    OutboxEventRepository outboxRepository) {
            this.kafkaTemplate = kafkaTemplate;
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            boolean connected;
            String error = null;
            try {
                var metrics = kafkaTemplate.metrics();
                connected = metrics != null && !metrics.isEmpty();
            } catch (Exception e) {
                connected = false;
                error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            }

            if (connected) {
                return Health.up().build();
            }
            Health.Builder builder = Health.status("DEGRADED")
                    .withDetail("note", "Richest member role changes wait in the outbox");
            try {
                builder.withDetail("pendingRankEvents", outboxRepository.countUnpublished());
            } catch (Exception e) {
                builder.withDetail("pendingRankEvents", "unknown");
            }
            return builder.withDetail("error", error != null ? error : "No Kafka producer connected").build();
        }
    }
}

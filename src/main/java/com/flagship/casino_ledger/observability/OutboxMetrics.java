package com.flagship.casino_ledger.observability;

import com.flagship.casino_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rank event delivery: how many role changes wait in the outbox, how long the
 * oldest has waited, and how sends to Kafka went.
 *
 * Gauges read values cached by {@link MetricsScheduler}; a scrape never queries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong pending = new AtomicLong(0);
    private final AtomicLong oldestPendingSeconds = new AtomicLong(0);
    private final AtomicLong deadLetters = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("casino.rank.outbox.pending", pending, AtomicLong::get)
                .description("Role change events not yet sent to Kafka")
                .register(meterRegistry);

        Gauge.builder("casino.rank.outbox.oldest.seconds", oldestPendingSeconds, AtomicLong::get)
                .description("How long the oldest unsent role change has waited")
                .register(meterRegistry);

        Gauge.builder("casino.rank.outbox.dead_letters", deadLetters, AtomicLong::get)
                .description("Role change events that ran out of send attempts")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            pending.set(outboxRepository.countUnpublished());
            oldestPendingSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                    .orElse(0L));
            deadLetters.set(outboxRepository.countByRetryCountGreaterThanEqual(maxRetries));

            log.debug("Rank outbox metrics refreshed: pending={}, oldest={}s, deadLetters={}",
                    pending.get(), oldestPendingSeconds.get(), deadLetters.get());
        } catch (Exception e) {
            log.warn("Failed to refresh rank outbox metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        recordSend(eventType, "sent");
    }

    public void recordEventPublishFailed(String eventType) {
        recordSend(eventType, "failed");
    }

    public void recordEventDeadLettered(String eventType) {
        recordSend(eventType, "abandoned");
    }

    private void recordSend(String eventType, String outcome) {
        meterRegistry.counter("casino.rank.events.sent", "event_type", eventType, "outcome", outcome).increment();
    }
}

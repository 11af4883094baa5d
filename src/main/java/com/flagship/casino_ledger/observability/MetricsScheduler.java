package com.flagship.casino_ledger.observability;

import com.flagship.casino_ledger.session.GameSessionCoordinator;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final GameSessionCoordinator sessions;
    private final MeterRegistry meterRegistry;

    private final AtomicLong activeSessions = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("casino.sessions.active", activeSessions, AtomicLong::get)
                .description("Game sessions currently in play")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refreshMetrics();
        try {
            activeSessions.set(sessions.countActiveSessions());
        } catch (Exception e) {
            log.warn("Failed to refresh session gauge: {}", e.getMessage());
        }
    }
}

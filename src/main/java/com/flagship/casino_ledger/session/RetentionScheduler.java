package com.flagship.casino_ledger.session;

import com.flagship.casino_ledger.config.CasinoProperties;
import com.flagship.casino_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Nightly cleanup of finished sessions and already-published outbox rows.
 * Active sessions are never touched here; they are recovered on the player's next action.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetentionScheduler {

    private final GameSessionCoordinator sessions;
    private final OutboxService outboxService;
    private final CasinoProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${casino.session.prune-cron:0 0 4 * * *}")
    public void prune() {
        int retentionDays = properties.getSession().getRetentionDays();
        try {
            int games = sessions.pruneOldGames(retentionDays);
            Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
            int events = outboxService.purgePublishedBefore(cutoff);
            log.info("Retention pass done: sessionsPruned={}, outboxPurged={}, retentionDays={}",
                    games, events, retentionDays);
        } catch (Exception e) {
            log.error("Retention pass failed, will retry on next schedule", e);
        }
    }
}

package com.flagship.casino_ledger.observability;

import com.flagship.casino_ledger.game.GameOutcome;
import com.flagship.casino_ledger.ledger.GameSource;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Counters and timers for the casino economy.
 *
 * Metrics exposed:
 * - casino.wager.placed: wagers debited, tagged by game
 * - casino.game.resolved: settled outcomes, tagged by game and outcome kind
 * - casino.payout.amount: distribution of coins returned to players
 * - casino.crash.refunds: abandoned sessions refunded, tagged by game
 * - casino.jackpot.hits: progressive jackpot wins
 * - casino.storage.retries: transient storage conflicts retried
 * - casino.game.action.duration: latency of game actions
 */
@Component
public class CasinoMetrics {

    private final MeterRegistry registry;
    private final DistributionSummary payouts;

    public CasinoMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.payouts = DistributionSummary.builder("casino.payout.amount")
                .description("Coins returned to players per settled outcome")
                .baseUnit("coins")
                .register(registry);
    }

    public void recordWagerPlaced(GameSource source, long amount) {
        registry.counter("casino.wager.placed", "game", source.dbValue()).increment();
        registry.counter("casino.wager.coins", "game", source.dbValue()).increment(amount);
    }

    public void recordOutcome(GameOutcome outcome) {
        registry.counter("casino.game.resolved",
                "game", outcome.getSource().dbValue(),
                "outcome", outcome.getKind().name().toLowerCase()
        ).increment();
        if (outcome.getPayout() > 0) {
            payouts.record(outcome.getPayout());
        }
    }

    public void recordCrashRefund(GameSource source) {
        registry.counter("casino.crash.refunds", "game", source.dbValue()).increment();
    }

    public void recordJackpotHit() {
        registry.counter("casino.jackpot.hits").increment();
    }

    public void recordStorageRetry(String operation) {
        registry.counter("casino.storage.retries", "operation", sanitizeTag(operation)).increment();
    }

    public void recordRejected(String operation, String reason) {
        registry.counter("casino.operation.rejected",
                "operation", sanitizeTag(operation),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public <T> T timeAction(GameSource source, String action, Supplier<T> work) {
        Timer timer = Timer.builder("casino.game.action.duration")
                .tag("game", source.dbValue())
                .tag("action", sanitizeTag(action))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        return timer.record(work);
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

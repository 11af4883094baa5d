package com.flagship.casino_ledger.game;

import com.flagship.casino_ledger.ledger.UpdateKind;
import com.flagship.casino_ledger.ledger.WalletService;
import com.flagship.casino_ledger.observability.CasinoMetrics;
import com.flagship.casino_ledger.stats.ExtraCounters;
import com.flagship.casino_ledger.stats.StatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a {@link GameOutcome} into its ledger entry and its stats update.
 *
 * Exactly one ledger entry per outcome: a win credits the payout, a push
 * returns the stake, a loss writes a zero-delta entry because the stake was
 * already debited when the bet was placed. Pushes are not counted as games.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutcomeSettler {

    private final WalletService walletService;
    private final StatsService statsService;
    private final CasinoMetrics metrics;

    /**
     * Writes the ledger entry and the stats row.
     *
     * @return the player's balance after settlement
     */
    public long settle(String userId, String guildId, GameOutcome outcome,
                       ExtraCounters extra, Map<String, Object> metadata) {
        long balance = applyToLedger(userId, guildId, outcome, metadata);
        applyToStats(userId, guildId, outcome, extra);
        return balance;
    }

    public long applyToLedger(String userId, String guildId, GameOutcome outcome, Map<String, Object> metadata) {
        Map<String, Object> entryMetadata = new LinkedHashMap<>();
        if (metadata != null) {
            entryMetadata.putAll(metadata);
        }
        entryMetadata.put("outcome", outcome.getKind().name().toLowerCase());
        entryMetadata.put("multiplier", outcome.getMultiplier());
        if (!outcome.getBonusFlags().isEmpty()) {
            entryMetadata.put("bonus_flags", outcome.getBonusFlags().stream()
                    .map(flag -> flag.name().toLowerCase())
                    .sorted()
                    .collect(Collectors.toList()));
        }

        long balance = switch (outcome.getKind()) {
            case WIN -> walletService.adjustBalance(userId, guildId, outcome.getPayout(),
                    outcome.getSource(), UpdateKind.BET_WON, entryMetadata);
            case PUSH -> walletService.adjustBalance(userId, guildId, outcome.getPayout(),
                    outcome.getSource(), UpdateKind.BET_PUSH, entryMetadata);
            case LOSS -> walletService.logTransaction(userId, guildId,
                    outcome.getSource(), UpdateKind.BET_LOST, entryMetadata);
        };

        metrics.recordOutcome(outcome);
        log.info("Outcome settled: userId={}, guildId={}, game={}, kind={}, wager={}, payout={}",
                userId, guildId, outcome.getSource().dbValue(), outcome.getKind(),
                outcome.getWager(), outcome.getPayout());
        return balance;
    }

    public void applyToStats(String userId, String guildId, GameOutcome outcome, ExtraCounters extra) {
        if (outcome.getKind() == OutcomeKind.PUSH) {
            statsService.recordExtraCounters(userId, guildId, outcome.getSource(), extra);
            return;
        }
        statsService.record(userId, guildId, outcome.getSource(), outcome.isWin(),
                outcome.getWager(), outcome.getPayout(), extra);
    }
}

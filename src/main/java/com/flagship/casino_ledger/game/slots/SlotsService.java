package com.flagship.casino_ledger.game.slots;

import com.flagship.casino_ledger.common.UnitOfWork;
import com.flagship.casino_ledger.game.BonusFlag;
import com.flagship.casino_ledger.game.GameOutcome;
import com.flagship.casino_ledger.game.OutcomeSettler;
import com.flagship.casino_ledger.game.WagerPolicy;
import com.flagship.casino_ledger.ledger.GameSource;
import com.flagship.casino_ledger.ledger.WalletService;
import com.flagship.casino_ledger.observability.CasinoMetrics;
import com.flagship.casino_ledger.observability.CorrelationContext;
import com.flagship.casino_ledger.session.GameSession;
import com.flagship.casino_ledger.session.GameSessionCoordinator;
import com.flagship.casino_ledger.stats.ExtraCounters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Single-shot slot spins. The session, the bet, the pool contribution, the
 * reels and the settlement all commit together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SlotsService {

    private static final GameSource GAME = GameSource.SLOTS;

    private final GameSessionCoordinator sessions;
    private final WalletService walletService;
    private final JackpotService jackpotService;
    private final OutcomeSettler settler;
    private final WagerPolicy wagerPolicy;
    private final UnitOfWork unitOfWork;
    private final RandomGenerator random;
    private final CasinoMetrics metrics;

    public SlotSpinResult spin(String userId, String guildId, long bet) {
        return CorrelationContext.withPlayer(userId, guildId, () -> metrics.timeAction(GAME, "spin", () -> {
            sessions.checkAndRecover(userId, guildId, GAME);
            wagerPolicy.validate(GAME, bet);

            return unitOfWork.execute("slots.spin", () -> {
                GameSession session = sessions.start(userId, guildId, GAME, bet, Map.of("bet", bet));
                walletService.placeBet(userId, guildId, bet, GAME, Map.of("session_id", session.getSessionId()));
                metrics.recordWagerPlaced(GAME, bet);

                long pool = jackpotService.contribute(guildId, bet);
                List<SlotSymbol> symbols = ReelEvaluator.spin(random);
                ReelResult reels = ReelEvaluator.evaluate(symbols, bet, 0);

                long jackpotWon = 0;
                if (reels.isJackpotHit()) {
                    jackpotWon = jackpotService.claim(guildId, userId);
                    reels = ReelEvaluator.evaluate(symbols, bet, jackpotWon);
                    metrics.recordJackpotHit();
                }

                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("session_id", session.getSessionId());
                metadata.put("reels", reels.display());

                ExtraCounters extra = ExtraCounters.empty();
                GameOutcome outcome = toOutcome(reels, bet);
                if (reels.isJackpotHit()) {
                    outcome = outcome.withFlag(BonusFlag.JACKPOT);
                    extra = extra.plus("jackpot_hits");
                    metadata.put("jackpot_won", jackpotWon);
                }
                long balance = settler.applyToLedger(userId, guildId, outcome, metadata);

                ReelResult bonusReels = null;
                long bonusPayout = 0;
                boolean claimed = reels.isJackpotHit();
                if (reels.isBonusSpin()) {
                    extra = extra.plus("bonus_spins");
                    List<SlotSymbol> bonusSymbols = ReelEvaluator.spin(random);
                    bonusReels = ReelEvaluator.evaluate(bonusSymbols, bet, 0);
                    long bonusJackpot = 0;
                    if (bonusReels.isJackpotHit()) {
                        bonusJackpot = jackpotService.claim(guildId, userId);
                        bonusReels = ReelEvaluator.evaluate(bonusSymbols, bet, bonusJackpot);
                        jackpotWon += bonusJackpot;
                        claimed = true;
                        extra = extra.plus("jackpot_hits");
                        metrics.recordJackpotHit();
                    }
                    if (bonusReels.isWin()) {
                        bonusPayout = bonusReels.getPayout();
                        Map<String, Object> bonusMetadata = new LinkedHashMap<>();
                        bonusMetadata.put("session_id", session.getSessionId());
                        bonusMetadata.put("reels", bonusReels.display());
                        bonusMetadata.put("bonus_spin", true);
                        GameOutcome bonus = GameOutcome.win(GAME, bet, bonusReels.getMultiplier(), bonusPayout)
                                .withFlag(BonusFlag.BONUS_SPIN);
                        if (bonusReels.isJackpotHit()) {
                            bonus = bonus.withFlag(BonusFlag.JACKPOT);
                            bonusMetadata.put("jackpot_won", bonusJackpot);
                        }
                        balance = settler.applyToLedger(userId, guildId, bonus, bonusMetadata);
                    }
                }

                GameOutcome wholeSpin = outcome.toBuilder().payout(outcome.getPayout() + bonusPayout).build();
                settler.applyToStats(userId, guildId, wholeSpin, extra);
                sessions.finish(userId, guildId, GAME);

                long poolAfter = claimed ? jackpotService.getJackpot(guildId).getAmount() : pool;
                log.info("Slot spin: sessionId={}, reels={}, payout={}, bonus={}",
                        session.getSessionId(), reels.display(), reels.getPayout(), bonusPayout);
                return new SlotSpinResult(bet, reels, bonusReels, jackpotWon,
                        reels.getPayout() + bonusPayout, poolAfter, balance);
            });
        }));
    }

    public Jackpot getJackpot(String guildId) {
        return jackpotService.getJackpot(guildId);
    }

    private static GameOutcome toOutcome(ReelResult reels, long bet) {
        if (!reels.isWin()) {
            return GameOutcome.loss(GAME, bet);
        }
        return GameOutcome.win(GAME, bet, reels.getMultiplier(), reels.getPayout());
    }
}

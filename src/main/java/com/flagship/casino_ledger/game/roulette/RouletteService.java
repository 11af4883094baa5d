package com.flagship.casino_ledger.game.roulette;

import com.flagship.casino_ledger.common.InvalidWagerException;
import com.flagship.casino_ledger.common.UnitOfWork;
import com.flagship.casino_ledger.config.CasinoProperties;
import com.flagship.casino_ledger.game.GameOutcome;
import com.flagship.casino_ledger.game.OutcomeSettler;
import com.flagship.casino_ledger.game.WagerPolicy;
import com.flagship.casino_ledger.ledger.GameSource;
import com.flagship.casino_ledger.ledger.UpdateKind;
import com.flagship.casino_ledger.ledger.WalletService;
import com.flagship.casino_ledger.observability.CasinoMetrics;
import com.flagship.casino_ledger.observability.CorrelationContext;
import com.flagship.casino_ledger.session.GameSession;
import com.flagship.casino_ledger.session.GameSessionCoordinator;
import com.flagship.casino_ledger.stats.ExtraCounters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * American roulette. A table stays open as an active session while chips are
 * placed; the session's bet amount always equals the chips on the felt, so a
 * crashed table refunds every one of them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RouletteService {

    private static final GameSource GAME = GameSource.ROULETTE;

    private final GameSessionCoordinator sessions;
    private final WalletService walletService;
    private final OutcomeSettler settler;
    private final WagerPolicy wagerPolicy;
    private final UnitOfWork unitOfWork;
    private final RandomGenerator random;
    private final CasinoProperties properties;
    private final CasinoMetrics metrics;

    public RouletteView openTable(String userId, String guildId) {
        return CorrelationContext.withPlayer(userId, guildId, () -> {
            sessions.checkAndRecover(userId, guildId, GAME);
            return unitOfWork.execute("roulette.open", () -> {
                RouletteTable table = new RouletteTable();
                sessions.start(userId, guildId, GAME, 0, table);
                return view(userId, guildId, table);
            });
        });
    }

    public RouletteView placeBet(String userId, String guildId, RouletteBetType type, String selection, long amount) {
        return CorrelationContext.withPlayer(userId, guildId, () -> metrics.timeAction(GAME, "bet", () -> {
            wagerPolicy.validate(GAME, amount);

            return unitOfWork.execute("roulette.bet", () -> {
                GameSession session = sessions.lockActive(userId, guildId, GAME);
                RouletteTable table = sessions.decodeState(session, RouletteTable.class);
                RouletteBet bet = RouletteEvaluator.admit(table, type, selection, amount,
                        properties.getRoulette().getMaxBetsPerSpin());

                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("session_id", session.getSessionId());
                metadata.put("bet_type", bet.getType().name().toLowerCase());
                if (bet.getSelection() != null) {
                    metadata.put("selection", bet.getSelection());
                }
                walletService.placeBet(userId, guildId, amount, GAME, metadata);
                metrics.recordWagerPlaced(GAME, amount);

                table.getBets().add(bet);
                sessions.updateState(userId, guildId, GAME, table, table.totalWagered());
                return view(userId, guildId, table);
            });
        }));
    }

    /**
     * Takes every chip back off the felt; the table stays open.
     */
    public RouletteView clearBets(String userId, String guildId) {
        return CorrelationContext.withPlayer(userId, guildId, () -> unitOfWork.execute("roulette.clear", () -> {
            GameSession session = sessions.lockActive(userId, guildId, GAME);
            RouletteTable table = sessions.decodeState(session, RouletteTable.class);
            refundAll(userId, guildId, session, table, "cleared");
            table.getBets().clear();
            sessions.updateState(userId, guildId, GAME, table, 0);
            return view(userId, guildId, table);
        }));
    }

    /**
     * Refunds the chips and closes the table.
     */
    public long cancel(String userId, String guildId) {
        return CorrelationContext.withPlayer(userId, guildId, () -> unitOfWork.execute("roulette.cancel", () -> {
            GameSession session = sessions.lockActive(userId, guildId, GAME);
            RouletteTable table = sessions.decodeState(session, RouletteTable.class);
            refundAll(userId, guildId, session, table, "cancelled");
            sessions.finish(userId, guildId, GAME);
            return walletService.getBalance(userId, guildId);
        }));
    }

    public RouletteSpinResult spin(String userId, String guildId) {
        return CorrelationContext.withPlayer(userId, guildId, () -> metrics.timeAction(GAME, "spin", () ->
            unitOfWork.execute("roulette.spin", () -> {
                GameSession session = sessions.lockActive(userId, guildId, GAME);
                RouletteTable table = sessions.decodeState(session, RouletteTable.class);
                if (table.getBets().isEmpty()) {
                    throw new InvalidWagerException("Place at least one bet before spinning");
                }

                Pocket pocket = RouletteEvaluator.spin(random);
                List<BetResult> results = RouletteEvaluator.evaluate(table.getBets(), pocket);

                ExtraCounters extra = ExtraCounters.of("wheel_" + pocket.color().name().toLowerCase());
                long totalPayout = 0;
                long balance = 0;
                for (BetResult result : results) {
                    RouletteBet bet = result.getBet();
                    extra = extra.plus(bet.getType().statKey() + (result.isWon() ? "_wins" : "_losses"));

                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("session_id", session.getSessionId());
                    metadata.put("bet_type", bet.getType().name().toLowerCase());
                    metadata.put("bet_amount", bet.getAmount());
                    metadata.put("winning_number", pocket.label());

                    GameOutcome outcome;
                    if (result.isWon()) {
                        if (bet.getType() == RouletteBetType.STRAIGHT) {
                            extra = extra.plus("straight_wins");
                        }
                        outcome = GameOutcome.win(GAME, bet.getAmount(),
                                BigDecimal.valueOf(bet.getPayoutRatio() + 1L), result.getPayout());
                        totalPayout += result.getPayout();
                    } else {
                        outcome = GameOutcome.loss(GAME, bet.getAmount());
                    }
                    balance = settler.applyToLedger(userId, guildId, outcome, metadata);
                }

                long totalWagered = table.totalWagered();
                GameOutcome wholeSpin = totalPayout > 0
                        ? GameOutcome.win(GAME, totalWagered,
                                BigDecimal.valueOf(totalPayout).divide(BigDecimal.valueOf(totalWagered), 4,
                                        RoundingMode.HALF_UP),
                                totalPayout)
                        : GameOutcome.loss(GAME, totalWagered);
                settler.applyToStats(userId, guildId, wholeSpin, extra);
                sessions.finish(userId, guildId, GAME);

                log.info("Roulette spin: sessionId={}, pocket={}, bets={}, wagered={}, payout={}",
                        session.getSessionId(), pocket, results.size(), totalWagered, totalPayout);
                return new RouletteSpinResult(pocket.label(), pocket.color(), results,
                        totalWagered, totalPayout, balance);
            })));
    }

    public Optional<RouletteView> getTable(String userId, String guildId) {
        return sessions.getActiveGame(userId, guildId, GAME)
                .map(session -> view(userId, guildId, sessions.decodeState(session, RouletteTable.class)));
    }

    private void refundAll(String userId, String guildId, GameSession session, RouletteTable table, String reason) {
        long total = table.totalWagered();
        if (total <= 0) {
            return;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("session_id", session.getSessionId());
        metadata.put("reason", reason);
        metadata.put("bets", table.getBets().size());
        walletService.adjustBalance(userId, guildId, total, GAME, UpdateKind.REFUND, metadata);
        log.info("Roulette bets refunded: sessionId={}, amount={}, reason={}", session.getSessionId(), total, reason);
    }

    private RouletteView view(String userId, String guildId, RouletteTable table) {
        return new RouletteView(List.copyOf(table.getBets()), table.totalWagered(),
                walletService.getBalance(userId, guildId));
    }
}

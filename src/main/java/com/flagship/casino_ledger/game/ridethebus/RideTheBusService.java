package com.flagship.casino_ledger.game.ridethebus;

import com.flagship.casino_ledger.common.InvalidWagerException;
import com.flagship.casino_ledger.common.UnitOfWork;
import com.flagship.casino_ledger.game.BonusFlag;
import com.flagship.casino_ledger.game.GameOutcome;
import com.flagship.casino_ledger.game.OutcomeSettler;
import com.flagship.casino_ledger.game.WagerPolicy;
import com.flagship.casino_ledger.game.deck.Deck;
import com.flagship.casino_ledger.ledger.GameSource;
import com.flagship.casino_ledger.ledger.UpdateKind;
import com.flagship.casino_ledger.ledger.WalletService;
import com.flagship.casino_ledger.observability.CasinoMetrics;
import com.flagship.casino_ledger.observability.CorrelationContext;
import com.flagship.casino_ledger.session.GameSession;
import com.flagship.casino_ledger.session.GameSessionCoordinator;
import com.flagship.casino_ledger.stats.ExtraCounters;
import com.flagship.casino_ledger.stats.StatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

@Service
@RequiredArgsConstructor
@Slf4j
public class RideTheBusService {

    private static final GameSource GAME = GameSource.RIDE_THE_BUS;

    private final GameSessionCoordinator sessions;
    private final WalletService walletService;
    private final StatsService statsService;
    private final OutcomeSettler settler;
    private final WagerPolicy wagerPolicy;
    private final UnitOfWork unitOfWork;
    private final RandomGenerator random;
    private final CasinoMetrics metrics;

    public RideTheBusView start(String userId, String guildId, long bet) {
        return CorrelationContext.withPlayer(userId, guildId, () -> metrics.timeAction(GAME, "start", () -> {
            sessions.checkAndRecover(userId, guildId, GAME);
            wagerPolicy.validate(GAME, bet);

            return unitOfWork.execute("ridethebus.start", () -> {
                RideTheBusState state = RideTheBusEngine.start(bet, Deck.shuffled(random));
                GameSession session = sessions.start(userId, guildId, GAME, bet, state);
                long balance = walletService.placeBet(userId, guildId, bet, GAME,
                        Map.of("session_id", session.getSessionId()));
                metrics.recordWagerPlaced(GAME, bet);
                return RideTheBusView.of(state, null, 0, balance);
            });
        }));
    }

    public RideTheBusView guess(String userId, String guildId, Guess guess) {
        return CorrelationContext.withPlayer(userId, guildId, () -> metrics.timeAction(GAME, "guess", () ->
            unitOfWork.execute("ridethebus.guess", () -> {
                GameSession session = sessions.lockActive(userId, guildId, GAME);
                RideTheBusState state = sessions.decodeState(session, RideTheBusState.class);
                Deck deck = Deck.restore(state.getDeck(), random);
                RoundResult result = RideTheBusEngine.play(state, deck, guess);

                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("session_id", session.getSessionId());
                metadata.put("round", result.getRound());
                metadata.put("choice", guess.name().toLowerCase());
                metadata.put("actual", result.getActual());

                if (result.isWon() && !result.isFinalWin()) {
                    long balance = walletService.logTransaction(userId, guildId, GAME, UpdateKind.ROUND_WON, metadata);
                    statsService.recordExtraCounters(userId, guildId, GAME, result.getCounters());
                    sessions.updateState(userId, guildId, GAME, state, state.getBet());
                    return RideTheBusView.of(state, result, 0, balance);
                }

                GameOutcome outcome = result.isWon()
                        ? GameOutcome.win(GAME, state.getBet(), BigDecimal.valueOf(state.getMultiplier()))
                        : GameOutcome.loss(GAME, state.getBet());
                long balance = settler.settle(userId, guildId, outcome, result.getCounters(), metadata);
                sessions.finish(userId, guildId, GAME);
                log.info("Ride the bus over: sessionId={}, round={}, won={}, payout={}",
                        session.getSessionId(), result.getRound(), result.isWon(), outcome.getPayout());
                return RideTheBusView.of(state, result, outcome.getPayout(), balance);
            })));
    }

    /**
     * Takes the bet times the multiplier earned so far and ends the ride.
     */
    public RideTheBusView cashOut(String userId, String guildId) {
        return CorrelationContext.withPlayer(userId, guildId, () -> metrics.timeAction(GAME, "cashout", () ->
            unitOfWork.execute("ridethebus.cashout", () -> {
                GameSession session = sessions.lockActive(userId, guildId, GAME);
                RideTheBusState state = sessions.decodeState(session, RideTheBusState.class);
                if (!state.canCashOut()) {
                    throw new InvalidWagerException("Win at least one round before cashing out");
                }

                GameOutcome outcome = GameOutcome.win(GAME, state.getBet(), BigDecimal.valueOf(state.getMultiplier()))
                        .withFlag(BonusFlag.CASHED_OUT);
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("session_id", session.getSessionId());
                metadata.put("round", state.getRound());
                metadata.put("choice", "cashout");
                long balance = settler.settle(userId, guildId, outcome, ExtraCounters.empty(), metadata);

                state.setFinished(true);
                sessions.finish(userId, guildId, GAME);
                log.info("Ride the bus cashed out: sessionId={}, multiplier={}, payout={}",
                        session.getSessionId(), state.getMultiplier(), outcome.getPayout());
                return RideTheBusView.of(state, null, outcome.getPayout(), balance);
            })));
    }

    public Optional<RideTheBusView> getGame(String userId, String guildId) {
        return sessions.getActiveGame(userId, guildId, GAME)
                .map(session -> RideTheBusView.of(sessions.decodeState(session, RideTheBusState.class),
                        null, 0, walletService.getBalance(userId, guildId)));
    }
}

package com.flagship.casino_ledger.game.blackjack;

import com.flagship.casino_ledger.common.UnitOfWork;
import com.flagship.casino_ledger.game.BonusFlag;
import com.flagship.casino_ledger.game.GameOutcome;
import com.flagship.casino_ledger.game.OutcomeKind;
import com.flagship.casino_ledger.game.OutcomeSettler;
import com.flagship.casino_ledger.game.WagerPolicy;
import com.flagship.casino_ledger.game.deck.Deck;
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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Runs blackjack rounds on top of the session table.
 *
 * The table (hands, dealer cards and undealt deck) lives in the session
 * snapshot; each player action locks the session row, replays the action on
 * the snapshot and either stores the new snapshot or settles every hand and
 * finishes the session, all in one unit of work.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlackjackService {

    private static final GameSource GAME = GameSource.BLACKJACK;

    private final GameSessionCoordinator sessions;
    private final WalletService walletService;
    private final OutcomeSettler settler;
    private final WagerPolicy wagerPolicy;
    private final UnitOfWork unitOfWork;
    private final RandomGenerator random;
    private final CasinoMetrics metrics;

    public BlackjackRound start(String userId, String guildId, long bet) {
        return CorrelationContext.withPlayer(userId, guildId, () -> metrics.timeAction(GAME, "start", () -> {
            sessions.checkAndRecover(userId, guildId, GAME);
            wagerPolicy.validate(GAME, bet);

            return unitOfWork.execute("blackjack.start", () -> {
                Deck deck = Deck.shuffled(random);
                BlackjackTable table = BlackjackEngine.deal(bet, deck);
                GameSession session = sessions.start(userId, guildId, GAME, bet, table);
                walletService.placeBet(userId, guildId, bet, GAME, Map.of("session_id", session.getSessionId()));
                metrics.recordWagerPlaced(GAME, bet);

                Optional<GameOutcome> opening = BlackjackEngine.resolveOpening(table);
                if (opening.isPresent()) {
                    long balance = settleHand(userId, guildId, session, 0, table.getHands().get(0), opening.get());
                    sessions.finish(userId, guildId, GAME);
                    log.info("Blackjack decided on the deal: sessionId={}, outcome={}",
                            session.getSessionId(), opening.get().getKind());
                    return BlackjackRound.of(table, List.of(opening.get()), balance);
                }
                return BlackjackRound.of(table, List.of(), walletService.getBalance(userId, guildId));
            });
        }));
    }

    public BlackjackRound hit(String userId, String guildId) {
        return act(userId, guildId, "hit", (table, deck) -> {
            BlackjackEngine.hit(table, deck);
            return 0L;
        });
    }

    public BlackjackRound stand(String userId, String guildId) {
        return act(userId, guildId, "stand", (table, deck) -> {
            BlackjackEngine.stand(table);
            return 0L;
        });
    }

    public BlackjackRound doubleDown(String userId, String guildId) {
        return act(userId, guildId, "double", BlackjackEngine::doubleDown);
    }

    public BlackjackRound split(String userId, String guildId) {
        return act(userId, guildId, "split", BlackjackEngine::split);
    }

    public Optional<BlackjackRound> getTable(String userId, String guildId) {
        return sessions.getActiveGame(userId, guildId, GAME)
                .map(session -> BlackjackRound.of(
                        sessions.decodeState(session, BlackjackTable.class),
                        List.of(),
                        walletService.getBalance(userId, guildId)));
    }

    private BlackjackRound act(String userId, String guildId, String action, TableAction move) {
        return CorrelationContext.withPlayer(userId, guildId, () -> metrics.timeAction(GAME, action, () ->
            unitOfWork.execute("blackjack." + action, () -> {
                GameSession session = sessions.lockActive(userId, guildId, GAME);
                BlackjackTable table = sessions.decodeState(session, BlackjackTable.class);
                if (table.getPhase() != TablePhase.PLAYER_TURN) {
                    throw new IllegalStateException("This blackjack round is already resolved");
                }
                Deck deck = Deck.restore(table.getDeck(), random);

                long extraStake = move.apply(table, deck);
                if (extraStake > 0) {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("session_id", session.getSessionId());
                    metadata.put("choice", action);
                    walletService.placeBet(userId, guildId, extraStake, GAME, metadata);
                    metrics.recordWagerPlaced(GAME, extraStake);
                }

                if (BlackjackEngine.awaitingDealer(table)) {
                    List<GameOutcome> outcomes = BlackjackEngine.resolve(table, deck);
                    table.setDeck(new ArrayList<>(deck.remainingCards()));
                    long balance = 0;
                    for (int i = 0; i < outcomes.size(); i++) {
                        balance = settleHand(userId, guildId, session, i, table.getHands().get(i), outcomes.get(i));
                    }
                    sessions.finish(userId, guildId, GAME);
                    log.info("Blackjack round resolved: sessionId={}, hands={}, dealerValue={}",
                            session.getSessionId(), outcomes.size(),
                            BlackjackRules.handValue(table.getDealerCards()));
                    return BlackjackRound.of(table, outcomes, balance);
                }

                table.setDeck(new ArrayList<>(deck.remainingCards()));
                sessions.updateState(userId, guildId, GAME, table, table.totalWagered());
                return BlackjackRound.of(table, List.of(), walletService.getBalance(userId, guildId));
            })));
    }

    private long settleHand(String userId, String guildId, GameSession session, int handIndex,
                            BlackjackHand hand, GameOutcome outcome) {
        ExtraCounters extra = ExtraCounters.empty();
        if (outcome.has(BonusFlag.NATURAL)) {
            extra = extra.plus("blackjack_wins");
        }
        if (hand.isDoubled() && outcome.getKind() != OutcomeKind.PUSH) {
            extra = extra.plus(outcome.isWin() ? "double_down_wins" : "double_down_losses");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("session_id", session.getSessionId());
        metadata.put("hand", handIndex);
        metadata.put("hand_value", hand.getValue());
        return settler.settle(userId, guildId, outcome, extra, metadata);
    }

    @FunctionalInterface
    private interface TableAction {
        /**
         * Applies a player decision and returns any additional stake it requires.
         */
        long apply(BlackjackTable table, Deck deck);
    }
}

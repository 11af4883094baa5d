package com.flagship.casino_ledger.game.blackjack;

import com.flagship.casino_ledger.common.InvalidWagerException;
import com.flagship.casino_ledger.game.BonusFlag;
import com.flagship.casino_ledger.game.GameOutcome;
import com.flagship.casino_ledger.game.deck.Card;
import com.flagship.casino_ledger.game.deck.Deck;
import com.flagship.casino_ledger.ledger.GameSource;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Blackjack rules as pure functions over a {@link BlackjackTable} and a {@link Deck}.
 * Nothing here touches the ledger; decisions come back as {@link GameOutcome}s.
 */
public final class BlackjackEngine {

    static final BigDecimal WIN_MULTIPLIER = BigDecimal.valueOf(2);
    static final BigDecimal NATURAL_MULTIPLIER = new BigDecimal("2.5");

    private BlackjackEngine() {
    }

    /**
     * Deals player, player, dealer, dealer.
     */
    public static BlackjackTable deal(long bet, Deck deck) {
        Card p1 = deck.draw();
        Card p2 = deck.draw();
        Card d1 = deck.draw();
        Card d2 = deck.draw();

        BlackjackTable table = new BlackjackTable();
        table.setBaseBet(bet);
        table.getHands().add(new BlackjackHand(bet, false, p1, p2));
        table.getDealerCards().add(d1);
        table.getDealerCards().add(d2);
        table.setDeck(new ArrayList<>(deck.remainingCards()));
        return table;
    }

    /**
     * Settles the round straight after the deal when a natural decides it.
     * The dealer peeks only with an ace or ten-value up-card: a dealer natural
     * pushes against a player natural and beats anything else; a player
     * natural alone pays 3:2.
     */
    public static Optional<GameOutcome> resolveOpening(BlackjackTable table) {
        BlackjackHand hand = table.getHands().get(0);
        long bet = hand.getBet();

        boolean dealerNatural = BlackjackRules.dealerPeeks(table.dealerUpCard())
                && BlackjackRules.isTwoCardTwentyOne(table.getDealerCards());

        GameOutcome outcome = null;
        if (dealerNatural) {
            outcome = hand.isNatural()
                    ? GameOutcome.push(GameSource.BLACKJACK, bet)
                    : GameOutcome.loss(GameSource.BLACKJACK, bet);
        } else if (hand.isNatural()) {
            long payout = bet * 5 / 2;
            outcome = GameOutcome.win(GameSource.BLACKJACK, bet, NATURAL_MULTIPLIER, payout)
                    .withFlag(BonusFlag.NATURAL);
        }

        if (outcome != null) {
            hand.setFinished(true);
            table.setPhase(TablePhase.RESOLVED);
        }
        return Optional.ofNullable(outcome);
    }

    public static void hit(BlackjackTable table, Deck deck) {
        BlackjackHand hand = table.currentHand();
        hand.add(deck.draw());
        if (hand.isBust()) {
            hand.setFinished(true);
        }
        advance(table);
    }

    public static void stand(BlackjackTable table) {
        table.currentHand().setFinished(true);
        advance(table);
    }

    /**
     * Doubles the current hand's bet, draws exactly one card and stands.
     *
     * @return the additional stake the player must put up
     */
    public static long doubleDown(BlackjackTable table, Deck deck) {
        BlackjackHand hand = table.currentHand();
        if (!hand.canDouble()) {
            throw new InvalidWagerException("This hand cannot be doubled");
        }
        long extra = hand.getBet();
        hand.setBet(hand.getBet() * 2);
        hand.setDoubled(true);
        hand.add(deck.draw());
        hand.setFinished(true);
        advance(table);
        return extra;
    }

    public static boolean canSplit(BlackjackTable table) {
        if (table.getPhase() != TablePhase.PLAYER_TURN || table.isSplit()) {
            return false;
        }
        BlackjackHand hand = table.getHands().get(0);
        List<Card> cards = hand.getCards();
        return !hand.isFromSplit()
                && cards.size() == 2
                && cards.get(0).blackjackValue() == cards.get(1).blackjackValue();
    }

    /**
     * Splits the opening pair into two hands, each completed with a fresh card
     * and each carrying the base bet.
     *
     * @return the additional stake the player must put up
     */
    public static long split(BlackjackTable table, Deck deck) {
        if (!canSplit(table)) {
            throw new InvalidWagerException("Only an unsplit pair of equal value can be split");
        }
        BlackjackHand original = table.getHands().get(0);
        Card first = original.getCards().get(0);
        Card second = original.getCards().get(1);
        long bet = table.getBaseBet();

        List<BlackjackHand> hands = new ArrayList<>();
        hands.add(new BlackjackHand(bet, true, first, deck.draw()));
        hands.add(new BlackjackHand(bet, true, second, deck.draw()));
        table.setHands(hands);
        table.setActiveHand(0);
        return bet;
    }

    /**
     * Plays the dealer and decides every hand. The dealer does not draw when
     * every player hand has already busted.
     */
    public static List<GameOutcome> resolve(BlackjackTable table, Deck deck) {
        boolean allBust = table.getHands().stream().allMatch(BlackjackHand::isBust);
        if (!allBust) {
            while (BlackjackRules.handValue(table.getDealerCards()) < BlackjackRules.DEALER_STANDS_AT) {
                table.getDealerCards().add(deck.draw());
            }
        }
        int dealerValue = BlackjackRules.handValue(table.getDealerCards());
        boolean dealerBust = dealerValue > BlackjackRules.BLACKJACK;

        List<GameOutcome> outcomes = new ArrayList<>();
        for (BlackjackHand hand : table.getHands()) {
            outcomes.add(flag(hand, decide(hand, dealerValue, dealerBust)));
        }
        table.setPhase(TablePhase.RESOLVED);
        return outcomes;
    }

    private static GameOutcome decide(BlackjackHand hand, int dealerValue, boolean dealerBust) {
        long bet = hand.getBet();
        if (hand.isBust()) {
            return GameOutcome.loss(GameSource.BLACKJACK, bet);
        }
        int value = hand.getValue();
        if (dealerBust || value > dealerValue) {
            return GameOutcome.win(GameSource.BLACKJACK, bet, WIN_MULTIPLIER);
        }
        if (value < dealerValue) {
            return GameOutcome.loss(GameSource.BLACKJACK, bet);
        }
        return GameOutcome.push(GameSource.BLACKJACK, bet);
    }

    private static GameOutcome flag(BlackjackHand hand, GameOutcome outcome) {
        GameOutcome flagged = outcome;
        if (hand.isDoubled()) {
            flagged = flagged.withFlag(BonusFlag.DOUBLED);
        }
        if (hand.isFromSplit()) {
            flagged = flagged.withFlag(BonusFlag.SPLIT_HAND);
        }
        return flagged;
    }

    private static void advance(BlackjackTable table) {
        List<BlackjackHand> hands = table.getHands();
        for (int i = 0; i < hands.size(); i++) {
            if (!hands.get(i).isFinished()) {
                table.setActiveHand(i);
                return;
            }
        }
        table.setActiveHand(hands.size());
    }

    /** True once every hand has stood, doubled or busted. */
    public static boolean awaitingDealer(BlackjackTable table) {
        return table.getPhase() == TablePhase.PLAYER_TURN
                && table.getHands().stream().allMatch(BlackjackHand::isFinished);
    }
}

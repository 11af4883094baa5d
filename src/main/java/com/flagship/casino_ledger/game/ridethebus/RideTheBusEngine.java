package com.flagship.casino_ledger.game.ridethebus;

import com.flagship.casino_ledger.common.InvalidWagerException;
import com.flagship.casino_ledger.game.deck.Card;
import com.flagship.casino_ledger.game.deck.Deck;
import com.flagship.casino_ledger.stats.ExtraCounters;

import java.util.ArrayList;

/**
 * Four-round ladder. Red or black, then higher or lower than the first card,
 * then inside or outside the first two, then the suit. Ties and matching
 * ranks go to the house.
 */
public final class RideTheBusEngine {

    public static final int ROUNDS = 4;

    private static final int[] MULTIPLIERS = {2, 3, 4, 8};

    private RideTheBusEngine() {
    }

    public static RideTheBusState start(long bet, Deck deck) {
        return new RideTheBusState(bet, deck.remainingCards());
    }

    public static int multiplierFor(int round) {
        return MULTIPLIERS[round - 1];
    }

    /**
     * Draws the next card and scores the guess. On a correct guess below the
     * last round the state moves on; otherwise it is finished.
     */
    public static RoundResult play(RideTheBusState state, Deck deck, Guess guess) {
        if (state.isFinished()) {
            throw new IllegalStateException("This ride is already over");
        }
        if (guess == null || guess.round() != state.getRound()) {
            throw new InvalidWagerException("Round " + state.getRound() + " does not take the guess " + guess);
        }

        int round = state.getRound();
        Card card = deck.draw();
        state.getCards().add(card);

        RoundResult result;
        switch (round) {
            case 1:
                result = colour(card, guess);
                break;
            case 2:
                result = higherOrLower(state, card, guess);
                break;
            case 3:
                result = insideOrOutside(state, card, guess);
                break;
            default:
                result = suit(card, guess);
                break;
        }

        state.setDeck(new ArrayList<>(deck.remainingCards()));
        if (result.isWon()) {
            state.setMultiplier(multiplierFor(round));
            if (round < ROUNDS) {
                state.setRound(round + 1);
            } else {
                state.setFinished(true);
            }
        } else {
            state.setFinished(true);
        }
        return result;
    }

    private static RoundResult colour(Card card, Guess guess) {
        boolean red = card.isRed();
        boolean won = (guess == Guess.RED) == red;
        ExtraCounters counters = tally(1, won).plus(red ? "red_count" : "black_count");
        return new RoundResult(1, guess, card, won, red ? "red" : "black", counters);
    }

    private static RoundResult higherOrLower(RideTheBusState state, Card card, Guess guess) {
        int first = state.getCards().get(0).getRank();
        if (card.getRank() == first) {
            return new RoundResult(2, guess, card, false, "tie", tally(2, false));
        }
        boolean higher = card.getRank() > first;
        boolean won = (guess == Guess.HIGHER) == higher;
        return new RoundResult(2, guess, card, won, higher ? "higher" : "lower", tally(2, won));
    }

    private static RoundResult insideOrOutside(RideTheBusState state, Card card, Guess guess) {
        int first = state.getCards().get(0).getRank();
        int second = state.getCards().get(1).getRank();
        if (card.getRank() == first || card.getRank() == second) {
            return new RoundResult(3, guess, card, false, "match", tally(3, false));
        }
        int low = Math.min(first, second);
        int high = Math.max(first, second);
        boolean inside = low < card.getRank() && card.getRank() < high;
        boolean won = (guess == Guess.INSIDE) == inside;
        return new RoundResult(3, guess, card, won, inside ? "inside" : "outside", tally(3, won));
    }

    private static RoundResult suit(Card card, Guess guess) {
        boolean won = card.getSuit() == guess.suit();
        ExtraCounters counters = tally(4, won);
        if (won) {
            counters = counters.plus("wins_8x");
        }
        return new RoundResult(4, guess, card, won, card.getSuit().name().toLowerCase(), counters);
    }

    private static ExtraCounters tally(int round, boolean won) {
        return ExtraCounters.of("round_" + round + (won ? "_wins" : "_losses"));
    }
}

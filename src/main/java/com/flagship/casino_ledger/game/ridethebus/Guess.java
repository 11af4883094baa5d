package com.flagship.casino_ledger.game.ridethebus;

import com.flagship.casino_ledger.game.deck.Suit;

/**
 * Every call a player can make, tagged with the round it belongs to.
 */
public enum Guess {
    RED(1),
    BLACK(1),
    HIGHER(2),
    LOWER(2),
    INSIDE(3),
    OUTSIDE(3),
    HEARTS(4),
    DIAMONDS(4),
    CLUBS(4),
    SPADES(4);

    private final int round;

    Guess(int round) {
        this.round = round;
    }

    public int round() {
        return round;
    }

    Suit suit() {
        return Suit.valueOf(name());
    }
}

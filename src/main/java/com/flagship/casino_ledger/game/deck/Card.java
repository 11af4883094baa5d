package com.flagship.casino_ledger.game.deck;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * A playing card. Ranks run 2..14 with 11 = jack, 12 = queen, 13 = king and 14 = ace.
 */
@Value
public class Card {
    public static final int JACK = 11;
    public static final int QUEEN = 12;
    public static final int KING = 13;
    public static final int ACE = 14;

    int rank;
    Suit suit;

    public static Card of(int rank, Suit suit) {
        if (rank < 2 || rank > ACE) {
            throw new IllegalArgumentException("Card rank out of range: " + rank);
        }
        if (suit == null) {
            throw new IllegalArgumentException("Card suit is required");
        }
        return new Card(rank, suit);
    }

    @JsonIgnore
    public boolean isRed() {
        return suit.isRed();
    }

    @JsonIgnore
    public boolean isAce() {
        return rank == ACE;
    }

    /** Tens and face cards. */
    @JsonIgnore
    public boolean isTenValue() {
        return rank >= 10 && rank <= KING;
    }

    /** Face value in blackjack; an ace counts high here and is demoted by the hand. */
    public int blackjackValue() {
        if (rank == ACE) {
            return 11;
        }
        return Math.min(rank, 10);
    }

    public String label() {
        String face = switch (rank) {
            case JACK -> "J";
            case QUEEN -> "Q";
            case KING -> "K";
            case ACE -> "A";
            default -> String.valueOf(rank);
        };
        return face + suit.symbol();
    }
}

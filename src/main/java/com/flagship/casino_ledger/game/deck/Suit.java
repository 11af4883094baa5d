package com.flagship.casino_ledger.game.deck;

public enum Suit {
    HEARTS("♥", true),
    DIAMONDS("♦", true),
    CLUBS("♣", false),
    SPADES("♠", false);

    private final String symbol;
    private final boolean red;

    Suit(String symbol, boolean red) {
        this.symbol = symbol;
        this.red = red;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isRed() {
        return red;
    }
}

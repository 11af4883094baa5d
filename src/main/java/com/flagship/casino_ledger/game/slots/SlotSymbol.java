package com.flagship.casino_ledger.game.slots;

/**
 * Reel symbols, rarest first. The weight is the symbol's share of one reel.
 */
public enum SlotSymbol {
    HOG("🐷", 1),
    TREE("🎄", 2),
    BELL("🔔", 3),
    SNOWFLAKE("❄️", 3),
    SANTA("🎅", 4),
    GIFT("🎁", 6);

    private final String emoji;
    private final int weight;

    SlotSymbol(String emoji, int weight) {
        this.emoji = emoji;
        this.weight = weight;
    }

    public String emoji() {
        return emoji;
    }

    public int weight() {
        return weight;
    }

    public boolean grantsBonusSpin() {
        return this == TREE || this == SNOWFLAKE;
    }
}

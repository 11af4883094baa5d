package com.flagship.casino_ledger.game.roulette;

import lombok.Value;

import java.util.List;

/**
 * A chip on the table. The pockets it covers and its payout ratio are fixed
 * when the bet is placed, so settling is a lookup against the winning pocket.
 */
@Value
public class RouletteBet {
    RouletteBetType type;
    /** Pocket label for a straight bet, null for outside bets. */
    String selection;
    long amount;
    /** Labels of the pockets this bet wins on. */
    List<String> coveredPockets;
    int payoutRatio;

    /**
     * @param selection the pocket label for a straight bet, ignored for outside bets
     * @throws IllegalArgumentException if a straight bet names no valid pocket
     */
    public static RouletteBet place(RouletteBetType type, String selection, long amount) {
        if (type.isOutside()) {
            return new RouletteBet(type, null, amount, type.coveredPockets(null), type.payoutRatio());
        }
        Pocket pocket = Pocket.parse(selection);
        return new RouletteBet(type, pocket.label(), amount, type.coveredPockets(pocket), type.payoutRatio());
    }

    public boolean covers(Pocket pocket) {
        return coveredPockets != null && coveredPockets.contains(pocket.label());
    }

    public String describe() {
        return type == RouletteBetType.STRAIGHT ? "straight " + selection : type.name().toLowerCase();
    }
}

package com.flagship.casino_ledger.game.slots;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class ReelResult {
    List<SlotSymbol> symbols;
    /** Total-return multiple of the bet; zero on a losing spin. */
    BigDecimal multiplier;
    boolean jackpotHit;
    boolean bonusSpin;
    /** Coins returned, including the pool on a jackpot. */
    long payout;

    public boolean isWin() {
        return payout > 0;
    }

    public String display() {
        StringBuilder line = new StringBuilder();
        for (SlotSymbol symbol : symbols) {
            line.append(symbol.emoji());
        }
        return line.toString();
    }
}

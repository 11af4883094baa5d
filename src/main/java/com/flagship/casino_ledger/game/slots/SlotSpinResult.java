package com.flagship.casino_ledger.game.slots;

import lombok.Value;

import java.util.Optional;

@Value
public class SlotSpinResult {
    long bet;
    ReelResult reels;
    /** Free re-spin awarded by a tree or snowflake triple. */
    ReelResult bonusReels;
    long jackpotWon;
    long totalPayout;
    long poolAfter;
    long balance;

    public Optional<ReelResult> getBonus() {
        return Optional.ofNullable(bonusReels);
    }
}

package com.flagship.casino_ledger.game.roulette;

import lombok.Value;

@Value
public class BetResult {
    RouletteBet bet;
    boolean won;
    /** Stake plus winnings, zero for a losing bet. */
    long payout;
}

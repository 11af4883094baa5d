package com.flagship.casino_ledger.game.ridethebus;

import com.flagship.casino_ledger.game.deck.Card;
import com.flagship.casino_ledger.stats.ExtraCounters;
import lombok.Value;

@Value
public class RoundResult {
    int round;
    Guess guess;
    Card card;
    boolean won;
    /** What actually came up: a colour, higher/lower/tie, inside/outside/match or a suit. */
    String actual;
    ExtraCounters counters;

    public boolean isFinalWin() {
        return won && round == RideTheBusEngine.ROUNDS;
    }
}

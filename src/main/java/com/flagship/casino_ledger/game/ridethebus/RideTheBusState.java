package com.flagship.casino_ledger.game.ridethebus;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.casino_ledger.game.deck.Card;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Session snapshot between rounds.
 */
@Data
@NoArgsConstructor
public class RideTheBusState {
    private long bet;
    /** Round awaiting a guess, 1 to 4. */
    private int round = 1;
    /** Multiplier locked in by the last won round; zero before the first win. */
    private int multiplier;
    private List<Card> cards = new ArrayList<>();
    private List<Card> deck = new ArrayList<>();
    private boolean finished;

    public RideTheBusState(long bet, List<Card> deck) {
        this.bet = bet;
        this.deck = new ArrayList<>(deck);
    }

    @JsonIgnore
    public boolean canCashOut() {
        return !finished && multiplier > 0;
    }
}

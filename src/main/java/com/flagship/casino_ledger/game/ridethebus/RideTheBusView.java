package com.flagship.casino_ledger.game.ridethebus;

import com.flagship.casino_ledger.game.deck.Card;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class RideTheBusView {
    long bet;
    int round;
    int multiplier;
    List<String> cards;
    RoundResult lastRound;
    boolean finished;
    boolean canCashOut;
    long payout;
    long balance;

    static RideTheBusView of(RideTheBusState state, RoundResult lastRound, long payout, long balance) {
        return new RideTheBusView(
                state.getBet(),
                state.getRound(),
                state.getMultiplier(),
                state.getCards().stream().map(Card::label).collect(Collectors.toList()),
                lastRound,
                state.isFinished(),
                state.canCashOut(),
                payout,
                balance
        );
    }
}

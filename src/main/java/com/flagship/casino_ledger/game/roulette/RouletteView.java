package com.flagship.casino_ledger.game.roulette;

import lombok.Value;

import java.util.List;

@Value
public class RouletteView {
    List<RouletteBet> bets;
    long totalWagered;
    long balance;
}

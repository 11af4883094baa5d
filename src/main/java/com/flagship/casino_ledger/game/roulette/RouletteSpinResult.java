package com.flagship.casino_ledger.game.roulette;

import lombok.Value;

import java.util.List;

@Value
public class RouletteSpinResult {
    String pocket;
    PocketColor color;
    List<BetResult> results;
    long totalWagered;
    long totalPayout;
    long balance;
}

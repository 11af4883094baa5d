package com.flagship.casino_ledger.game.roulette;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Session snapshot of an open roulette table: the chips on the felt.
 */
@Data
@NoArgsConstructor
public class RouletteTable {
    private List<RouletteBet> bets = new ArrayList<>();

    public long totalWagered() {
        return bets.stream().mapToLong(RouletteBet::getAmount).sum();
    }
}

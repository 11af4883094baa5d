package com.flagship.casino_ledger.game;

import com.flagship.casino_ledger.common.InvalidWagerException;
import com.flagship.casino_ledger.config.CasinoProperties;
import com.flagship.casino_ledger.ledger.GameSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Bet limits per game, checked before any coin moves.
 */
@Component
@RequiredArgsConstructor
public class WagerPolicy {

    private final CasinoProperties properties;

    public void validate(GameSource source, long amount) {
        long min = properties.getMinBet();
        long max = properties.maxBetFor(source);
        if (amount < min || amount > max) {
            throw new InvalidWagerException(String.format(
                    "%s bets must be between %d and %d coins, got %d", source.dbValue(), min, max, amount));
        }
    }
}

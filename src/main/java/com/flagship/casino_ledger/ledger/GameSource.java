package com.flagship.casino_ledger.ledger;

import java.util.Arrays;

/**
 * Where a balance change originated. Persisted in lower case.
 */
public enum GameSource {
    BLACKJACK,
    SLOTS,
    CEELO,
    RIDE_THE_BUS,
    ROULETTE,
    LOAN,
    BEG,
    ADMIN;

    public String dbValue() {
        return name().toLowerCase();
    }

    /**
     * Sources that move coins between players or from staff rather than
     * from play. They are left out of winnings rollups.
     */
    public boolean isNonGame() {
        return this == LOAN || this == BEG || this == ADMIN;
    }

    public static GameSource fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(source -> source.dbValue().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown game source: " + value));
    }
}

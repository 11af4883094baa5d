package com.flagship.casino_ledger.ledger;

import java.util.Arrays;

/**
 * Kind of ledger entry.
 *
 * BET_PLACED and ROUND_WON are intermediate: they are written while a game is
 * still in play. Every other kind is a resolved outcome and may move a player
 * on the leaderboard.
 */
public enum UpdateKind {
    BET_PLACED,
    BET_WON,
    BET_LOST,
    BET_PUSH,
    ROUND_WON,
    LOAN_SENT,
    LOAN_RECEIVED,
    BEG_RECEIVED,
    ADMIN_ADJUSTMENT,
    REFUND,
    CRASH_REFUND;

    public boolean isResolved() {
        return this != BET_PLACED && this != ROUND_WON;
    }

    public String dbValue() {
        return name().toLowerCase();
    }

    public static UpdateKind fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.dbValue().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown update kind: " + value));
    }
}

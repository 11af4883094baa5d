package com.flagship.casino_ledger.game;

/**
 * Special circumstances attached to an outcome.
 */
public enum BonusFlag {
    /** Two-card 21 paid at 3:2. */
    NATURAL,
    DOUBLED,
    SPLIT_HAND,
    JACKPOT,
    BONUS_SPIN,
    CASHED_OUT
}

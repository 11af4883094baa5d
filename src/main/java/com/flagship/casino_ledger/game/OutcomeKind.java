package com.flagship.casino_ledger.game;

public enum OutcomeKind {
    WIN,
    LOSS,
    PUSH
}

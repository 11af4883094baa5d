package com.flagship.casino_ledger.game.blackjack;

public enum TablePhase {
    PLAYER_TURN,
    RESOLVED
}

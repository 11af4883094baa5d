package com.flagship.casino_ledger.game.roulette;

public enum PocketColor {
    RED,
    BLACK,
    GREEN
}

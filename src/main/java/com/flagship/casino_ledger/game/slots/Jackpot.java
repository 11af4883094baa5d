package com.flagship.casino_ledger.game.slots;

import lombok.Value;

import java.time.Instant;

@Value
public class Jackpot {
    String guildId;
    long amount;
    String lastWinnerId;
    Instant lastWonAt;
    Instant updatedAt;
}

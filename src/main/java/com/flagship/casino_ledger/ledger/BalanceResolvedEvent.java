package com.flagship.casino_ledger.ledger;

import lombok.Value;

/**
 * Published inside the ledger transaction for every resolved entry.
 * Listeners bound to the commit phase only see changes that actually landed.
 */
@Value
public class BalanceResolvedEvent {
    String userId;
    String guildId;
    long balance;
    UpdateKind kind;
}

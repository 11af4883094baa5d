package com.flagship.casino_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable record of one balance change.
 *
 * Entries are append-only: the table rejects updates and deletes, and the
 * account balance always equals the sum of its entries' amounts.
 */
@Value
public class LedgerEntry {
    long id;
    String userId;
    String guildId;
    long amount;
    long balanceAfter;
    GameSource source;
    UpdateKind kind;
    Map<String, Object> metadata;
    Instant createdAt;
}

package com.flagship.casino_ledger.session;

import com.flagship.casino_ledger.ledger.GameSource;
import lombok.Value;

import java.time.Instant;

/**
 * Audit record written when an abandoned session is force-crashed and refunded.
 */
@Value
public class CrashRecord {
    long id;
    long sessionId;
    String userId;
    String guildId;
    GameSource source;
    long betAmount;
    long refundAmount;
    String crashReason;
    long durationSeconds;
    String stateJson;
    Instant gameStartedAt;
    Instant crashedAt;
}

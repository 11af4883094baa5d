package com.flagship.casino_ledger.session;

import com.flagship.casino_ledger.ledger.GameSource;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * One row of the session table: the persisted record of a game in play or
 * already resolved for a (user, community, game) key.
 *
 * The state snapshot is kept as raw JSON; each game decodes its own shape.
 */
@Value
public class GameSession {
    long sessionId;
    String userId;
    String guildId;
    GameSource source;
    SessionStatus status;
    long betAmount;
    String stateJson;
    String crashReason;
    Long refundAmount;
    Instant createdAt;
    Instant updatedAt;

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    public boolean isAbandoned(Instant now, Duration threshold) {
        return isActive() && age(now).compareTo(threshold) > 0;
    }
}

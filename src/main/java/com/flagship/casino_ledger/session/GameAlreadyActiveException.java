package com.flagship.casino_ledger.session;

import com.flagship.casino_ledger.ledger.GameSource;
import lombok.Getter;

/**
 * A game of this type is already running for the player in this community.
 * The caller should finish it or wait for it to time out.
 */
@Getter
public class GameAlreadyActiveException extends RuntimeException {

    private final GameSource source;

    public GameAlreadyActiveException(String userId, String guildId, GameSource source) {
        super(String.format("User %s already has an active %s game in guild %s",
                userId, source.dbValue(), guildId));
        this.source = source;
    }
}

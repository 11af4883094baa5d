package com.flagship.casino_ledger.session;

import com.flagship.casino_ledger.ledger.GameSource;

public class NoActiveGameException extends IllegalStateException {

    public NoActiveGameException(String userId, String guildId, GameSource source) {
        super(String.format("No active %s game for user %s in guild %s",
                source.dbValue(), userId, guildId));
    }
}

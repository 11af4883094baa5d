package com.flagship.casino_ledger.ledger;

import lombok.Value;

/**
 * A player's wallet in one community.
 */
@Value
public class Account {
    String userId;
    String guildId;
    long balance;
    long highWaterBalance;
    int begCount;
}

package com.flagship.casino_ledger.rank;

import lombok.Value;

@Value
public class RankedUser {
    int rank;
    String userId;
    long balance;
}

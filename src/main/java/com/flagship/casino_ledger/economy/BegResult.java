package com.flagship.casino_ledger.economy;

import lombok.Value;

@Value
public class BegResult {
    long amount;
    long balance;
    int begCount;
}

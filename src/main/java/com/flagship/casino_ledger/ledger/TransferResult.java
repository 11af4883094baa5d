package com.flagship.casino_ledger.ledger;

import lombok.Value;

@Value
public class TransferResult {
    long fromBalance;
    long toBalance;
}

package com.flagship.casino_ledger.economy;

import lombok.Value;

@Value
public class LoanResult {
    long amount;
    long senderBalance;
    long receiverBalance;
    int loansRemaining;
}

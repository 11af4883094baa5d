package com.flagship.casino_ledger.ledger;

import lombok.Getter;

@Getter
public class InsufficientFundsException extends RuntimeException {

    private final long balance;
    private final long requested;

    public InsufficientFundsException(String userId, long balance, long requested) {
        super(String.format("Insufficient funds for user %s: balance=%d, requested=%d",
                userId, balance, requested));
        this.balance = balance;
        this.requested = requested;
    }
}

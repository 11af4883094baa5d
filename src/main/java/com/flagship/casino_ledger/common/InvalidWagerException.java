package com.flagship.casino_ledger.common;

/**
 * A bet, selection or amount that is rejected before any balance is touched.
 */
public class InvalidWagerException extends IllegalArgumentException {

    public InvalidWagerException(String message) {
        super(message);
    }
}

package com.flagship.casino_ledger.economy;

import lombok.Getter;

import java.time.Duration;

/**
 * The sender has used up their loans for the current window. Retrying
 * before the window rolls over will fail the same way.
 */
@Getter
public class LoanRateLimitedException extends RuntimeException {

    private final int limit;
    private final Duration window;

    public LoanRateLimitedException(String userId, int limit, Duration window) {
        super(String.format("User %s has already sent %d loans in the last %d minutes",
                userId, limit, window.toMinutes()));
        this.limit = limit;
        this.window = window;
    }
}

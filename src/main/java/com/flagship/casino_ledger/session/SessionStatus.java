package com.flagship.casino_ledger.session;

import java.util.Arrays;

public enum SessionStatus {
    ACTIVE,
    FINISHED,
    CRASHED;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static SessionStatus fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.dbValue().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown session status: " + value));
    }
}

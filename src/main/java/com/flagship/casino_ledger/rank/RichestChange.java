package com.flagship.casino_ledger.rank;

import lombok.Value;

@Value
public class RichestChange {
    /** Null when nobody was recorded before. */
    String previousMemberId;
    String newMemberId;
}

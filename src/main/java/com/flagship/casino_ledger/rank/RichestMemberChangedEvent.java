package com.flagship.casino_ledger.rank;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The top balance of a guild moved to another member. Carries what the role
 * adapter needs to take the role from one member and give it to the other.
 */
@Value
public class RichestMemberChangedEvent {
    public static final String EVENT_TYPE = "RichestMemberChanged";
    public static final String AGGREGATE_TYPE = "Guild";

    UUID eventId;
    String guildId;
    String roleId;
    String previousMemberId;   // null when nobody held the role
    String newMemberId;
    long balance;
    Instant occurredAt;

    public static RichestMemberChangedEvent of(String guildId, String roleId, String previousMemberId,
                                               String newMemberId, long balance, Instant occurredAt) {
        return new RichestMemberChangedEvent(UUID.randomUUID(), guildId, roleId,
                previousMemberId, newMemberId, balance, occurredAt);
    }

    public String getEventType() {
        return EVENT_TYPE;
    }
}

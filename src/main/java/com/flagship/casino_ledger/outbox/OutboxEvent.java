package com.flagship.casino_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in the outbox table to be published.
 *
 * The row is written in the same transaction as the change it describes and
 * handed to Kafka later by {@link OutboxPublisher}. The aggregate id is the
 * Kafka key, so events of one aggregate (a guild) stay in order.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "Guild"
    String aggregateId;        // e.g. the guild id
    String eventType;          // e.g. "RichestMemberChanged"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}

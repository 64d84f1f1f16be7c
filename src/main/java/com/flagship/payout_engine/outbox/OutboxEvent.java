package com.flagship.payout_engine.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the transactional outbox.
 *
 * Written in the same database transaction as the payout change it
 * describes, then published to Kafka by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "PayoutTransaction"
    String aggregateId;        // transaction id
    String eventType;          // e.g. "PayoutStateChanged"
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
            null   // assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}

package com.flagship.live_event_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact waiting to be published to Kafka.
 *
 * Written in the same database transaction as the purchase, tip, refund or
 * status change it describes, so a committed change always has its event.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
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
            null // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}

package com.flagship.trip_settlement.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in the outbox table for the publisher.
 *
 * Written in the same transaction as the settlement change it describes, so the event exists
 * if and only if the change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Settlement" or "Trip"
    UUID aggregateId;
    String eventType;          // e.g. "SettlementSettled"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                              String payload, Instant createdAt) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
                createdAt, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}

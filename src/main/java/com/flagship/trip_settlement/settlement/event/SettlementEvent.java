package com.flagship.trip_settlement.settlement.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of settlement events written to the outbox.
 */
public interface SettlementEvent {

    /**
     * Unique identifier for this event instance, used by consumers for deduplication.
     */
    UUID getEventId();

    UUID getTripId();

    Instant getOccurredAt();

    String getEventType();
}

package com.flagship.trip_settlement.settlement.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when reconciliation changed the pending settlements of a trip.
 */
@Value
public class SettlementsReconciledEvent implements SettlementEvent {
    UUID eventId;
    UUID tripId;
    String baseCurrency;
    int created;
    int updated;
    int removed;
    int pendingCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SettlementsReconciled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}

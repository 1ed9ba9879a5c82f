package com.flagship.trip_settlement.settlement.event;

import com.flagship.trip_settlement.settlement.Settlement;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once when a settlement moves from PENDING to SETTLED.
 * Repeated mark-paid calls on the same settlement do not publish again.
 */
@Value
public class SettlementSettledEvent implements SettlementEvent {
    UUID eventId;
    UUID settlementId;
    UUID tripId;
    UUID fromUserId;
    UUID toUserId;
    long amount;
    String currency;
    UUID settledBy;
    String note;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SettlementSettled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementSettledEvent fromSettlement(Settlement settlement) {
        return new SettlementSettledEvent(
            UUID.randomUUID(),
            settlement.getId(),
            settlement.getTripId(),
            settlement.getFromUserId(),
            settlement.getToUserId(),
            settlement.getAmount(),
            settlement.getCurrency().getCode(),
            settlement.getSettledBy(),
            settlement.getNote(),
            settlement.getSettledAt()
        );
    }
}

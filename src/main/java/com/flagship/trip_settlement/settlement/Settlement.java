package com.flagship.trip_settlement.settlement;

import com.flagship.trip_settlement.fx.CurrencyCode;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A transfer from a debtor ({@code fromUserId}) to a creditor ({@code toUserId}) within one trip.
 *
 * Rows are created PENDING by reconciliation and move to SETTLED when somebody marks them paid.
 * SETTLED is terminal: amount, parties and stamps never change afterwards.
 */
@Value
public class Settlement {
    UUID id;
    UUID tripId;
    UUID fromUserId;
    UUID toUserId;
    long amount;
    CurrencyCode currency;
    SettlementStatus status;
    Instant settledAt;
    UUID settledBy;
    String note;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new PENDING settlement for a proposed transfer.
     */
    public static Settlement pending(UUID tripId, UUID fromUserId, UUID toUserId, long amount,
                                     CurrencyCode currency, Instant now) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Settlement amount must be positive, got " + amount);
        }
        if (fromUserId.equals(toUserId)) {
            throw new IllegalArgumentException("Settlement parties must differ: " + fromUserId);
        }
        return new Settlement(
            UUID.randomUUID(),
            tripId,
            fromUserId,
            toUserId,
            amount,
            currency,
            SettlementStatus.PENDING,
            null,
            null,
            null,
            now,
            now
        );
    }

    /**
     * Returns a copy with a new amount. Only PENDING rows can be re-priced.
     *
     * @throws IllegalStateException if the settlement is already settled
     */
    public Settlement withAmount(long newAmount, Instant now) {
        if (this.status != SettlementStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot change amount of settlement %s in %s status", this.id, this.status));
        }
        return new Settlement(id, tripId, fromUserId, toUserId, newAmount, currency, status,
                settledAt, settledBy, note, createdAt, now);
    }

    /**
     * Transitions the settlement to SETTLED.
     *
     * @throws IllegalStateException if the settlement is not PENDING
     */
    public Settlement markSettled(UUID actorId, String note, Instant now) {
        if (this.status != SettlementStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot settle settlement %s in %s status. Only PENDING settlements can be settled.",
                    this.id, this.status));
        }
        return new Settlement(id, tripId, fromUserId, toUserId, amount, currency, SettlementStatus.SETTLED,
                now, actorId, note, createdAt, now);
    }

    public boolean isSettled() {
        return status == SettlementStatus.SETTLED;
    }

    public boolean involves(UUID userId) {
        return fromUserId.equals(userId) || toUserId.equals(userId);
    }
}

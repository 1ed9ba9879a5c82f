package com.flagship.trip_settlement.settlement;

import com.flagship.trip_settlement.fx.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the {@code settlements} table.
 *
 * No setters: parties, trip and currency are fixed at creation, the amount changes only through
 * {@link #updateAmount} and the settled stamps are written by a conditional update in
 * {@link SettlementRepository}.
 */
@Entity
@Table(
    name = "settlements",
    indexes = {
        @Index(name = "idx_settlements_trip_status", columnList = "trip_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "trip_id", nullable = false, updatable = false)
    private UUID tripId;

    @Column(name = "from_user_id", nullable = false, updatable = false)
    private UUID fromUserId;

    @Column(name = "to_user_id", nullable = false, updatable = false)
    private UUID toUserId;

    @Column(nullable = false)
    private long amount;

    @Convert(converter = CurrencyCodeConverter.class)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SettlementStatus status;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Column(name = "settled_by")
    private UUID settledBy;

    @Column(name = "note", length = 500)
    private String note;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static SettlementEntity fromDomain(Settlement settlement) {
        return new SettlementEntity(
            settlement.getId(),
            settlement.getTripId(),
            settlement.getFromUserId(),
            settlement.getToUserId(),
            settlement.getAmount(),
            settlement.getCurrency(),
            settlement.getStatus(),
            settlement.getSettledAt(),
            settlement.getSettledBy(),
            settlement.getNote(),
            settlement.getCreatedAt(),
            settlement.getUpdatedAt()
        );
    }

    public Settlement toDomain() {
        return new Settlement(
            id,
            tripId,
            fromUserId,
            toUserId,
            amount,
            currency,
            status,
            settledAt,
            settledBy,
            note,
            createdAt,
            updatedAt
        );
    }

    void updateAmount(long newAmount, Instant now) {
        if (this.status != SettlementStatus.PENDING) {
            throw new IllegalStateException("Settled settlement " + id + " cannot be re-priced");
        }
        this.amount = newAmount;
        this.updatedAt = now;
    }
}

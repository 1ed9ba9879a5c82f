package com.flagship.trip_settlement.expense;

import com.flagship.trip_settlement.fx.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A shared expense as handed over by the persistence collaborator.
 *
 * Amounts are minor units of {@code currency}. {@code fxRateToBase} is the rate snapshot
 * taken when the expense was recorded: multiplying a minor-unit amount by it yields base-currency
 * minor units. It is null when no rate could be resolved. {@code currency} is null when the stored code is
 * not an ISO-4217 currency; such an expense cannot be converted and is left out of balances.
 */
@Value
public class Expense {
    UUID id;
    UUID tripId;
    long amount;
    CurrencyCode currency;
    BigDecimal fxRateToBase;
    UUID payerId;
    Instant createdAt;
    List<Share> shares;

    public Expense(UUID id, UUID tripId, long amount, CurrencyCode currency, BigDecimal fxRateToBase,
                   UUID payerId, Instant createdAt, List<Share> shares) {
        this.id = id;
        this.tripId = tripId;
        this.amount = amount;
        this.currency = currency;
        this.fxRateToBase = fxRateToBase;
        this.payerId = payerId;
        this.createdAt = createdAt;
        this.shares = shares == null ? List.of() : List.copyOf(shares);
    }

    /**
     * Sum of all share amounts; equals {@link #getAmount()} for well-formed expenses.
     */
    public long getShareTotal() {
        return shares.stream().mapToLong(Share::getShareAmount).sum();
    }
}

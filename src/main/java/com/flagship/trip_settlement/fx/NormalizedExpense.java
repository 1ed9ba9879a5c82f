package com.flagship.trip_settlement.fx;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * An expense expressed in the trip's base currency.
 *
 * When {@code needsConversion} is true the expense could not be converted: amounts are zero,
 * {@code shares} is empty and the expense must be left out of aggregation.
 */
@Value
public class NormalizedExpense {
    UUID expenseId;
    UUID payerId;
    CurrencyCode baseCurrency;
    long convertedAmount;
    BigDecimal effectiveRate;
    boolean converted;
    boolean needsConversion;
    List<NormalizedShare> shares;

    static NormalizedExpense unconvertible(UUID expenseId, UUID payerId, CurrencyCode baseCurrency) {
        return new NormalizedExpense(expenseId, payerId, baseCurrency, 0L, null, false, true, List.of());
    }

    public long getShareTotal() {
        return shares.stream().mapToLong(NormalizedShare::getAmount).sum();
    }

    @Value
    public static class NormalizedShare {
        UUID userId;
        long amount;
    }
}

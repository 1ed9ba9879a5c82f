package com.flagship.trip_settlement.balance;

import com.flagship.trip_settlement.fx.CurrencyCode;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Result of folding a trip's expenses into per-user balances.
 *
 * {@code balances} is sorted by net balance descending, ties by user id ascending.
 */
@Value
public class BalanceSheet {
    CurrencyCode baseCurrency;
    List<UserBalance> balances;
    List<UUID> excludedExpenseIds;
    int totalExpensesUsed;
    int conversionsPerformed;

    public long getNetTotal() {
        return balances.stream().mapToLong(UserBalance::getNetBalance).sum();
    }
}

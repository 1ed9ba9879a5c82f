package com.flagship.trip_settlement.settlement;

import com.flagship.trip_settlement.balance.UserBalance;
import com.flagship.trip_settlement.fx.CurrencyCode;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Everything a client needs to show who owes whom on a trip.
 */
@Value
public class SettlementSummary {
    UUID tripId;
    CurrencyCode baseCurrency;
    List<UserBalance> balances;
    List<Settlement> pendingSettlements;
    List<Settlement> settledSettlements;
    int totalExpensesUsed;
    List<UUID> excludedExpenseIds;
}

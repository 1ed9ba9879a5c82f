package com.flagship.trip_settlement.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trip_settlement.settlement.SettlementSummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SettlementSummaryResponse {

    @JsonProperty("trip_id")
    UUID tripId;

    @JsonProperty("base_currency")
    String baseCurrency;

    @JsonProperty("balances")
    List<UserBalanceResponse> balances;

    @JsonProperty("pending_settlements")
    List<SettlementResponse> pendingSettlements;

    @JsonProperty("settled_settlements")
    List<SettlementResponse> settledSettlements;

    @JsonProperty("total_expenses_used")
    int totalExpensesUsed;

    @JsonProperty("excluded_expense_ids")
    List<UUID> excludedExpenseIds;

    public static SettlementSummaryResponse from(SettlementSummary summary) {
        return SettlementSummaryResponse.builder()
            .tripId(summary.getTripId())
            .baseCurrency(summary.getBaseCurrency().getCode())
            .balances(summary.getBalances().stream().map(UserBalanceResponse::from).toList())
            .pendingSettlements(summary.getPendingSettlements().stream().map(SettlementResponse::from).toList())
            .settledSettlements(summary.getSettledSettlements().stream().map(SettlementResponse::from).toList())
            .totalExpensesUsed(summary.getTotalExpensesUsed())
            .excludedExpenseIds(summary.getExcludedExpenseIds())
            .build();
    }
}

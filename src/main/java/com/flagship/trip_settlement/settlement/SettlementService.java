package com.flagship.trip_settlement.settlement;

import com.flagship.trip_settlement.access.SettlementAuthorizer;
import com.flagship.trip_settlement.balance.BalanceAggregator;
import com.flagship.trip_settlement.balance.BalanceSheet;
import com.flagship.trip_settlement.common.exception.NotFoundException;
import com.flagship.trip_settlement.expense.ExpenseSource;
import com.flagship.trip_settlement.fx.CurrencyCode;
import com.flagship.trip_settlement.observability.CorrelationContext;
import com.flagship.trip_settlement.observability.SettlementMetrics;
import com.flagship.trip_settlement.trip.TripDirectory;
import com.flagship.trip_settlement.trip.TripLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for settlement reads and writes.
 *
 * Summaries are computed without locking and report the stored pending rows, which may lag behind
 * the latest expenses until the next reconciliation. Reconciliation and mark-paid run under the
 * trip lock, so two writers never interleave on one trip.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private final TripDirectory tripDirectory;
    private final ExpenseSource expenseSource;
    private final SettlementStore settlementStore;
    private final BalanceAggregator balanceAggregator;
    private final SettlementOptimizer settlementOptimizer;
    private final SettlementLedger settlementLedger;
    private final SettlementAuthorizer settlementAuthorizer;
    private final TripLock tripLock;
    private final SettlementMetrics metrics;

    /**
     * Computes balances from the expenses {@code viewerId} can see, alongside the stored settlement rows.
     *
     * @throws NotFoundException if the trip or its base currency cannot be resolved
     */
    @Transactional(readOnly = true)
    public SettlementSummary computeSettlementSummary(UUID tripId, UUID viewerId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TRIP_ID_MDC_KEY, tripId.toString());
        try {
            CurrencyCode baseCurrency = resolveBaseCurrency(tripId);
            List<Settlement> settlements = settlementStore.findByTrip(tripId);
            BalanceSheet sheet = aggregate(tripId, viewerId, baseCurrency, settlements);

            SettlementSummary summary = toSummary(tripId, sheet,
                    settlements.stream().filter(s -> !s.isSettled()).toList(), settlements);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSummaryComputed(sheet.getExcludedExpenseIds().size());
            metrics.recordLatency("summary", duration);
            log.info("Computed settlement summary: balances={}, pending={}, excluded={}, duration={}ms",
                    summary.getBalances().size(), summary.getPendingSettlements().size(),
                    summary.getExcludedExpenseIds().size(), duration);
            return summary;
        } finally {
            MDC.remove(CorrelationContext.TRIP_ID_MDC_KEY);
        }
    }

    /**
     * Recomputes the transfer plan and replaces the trip's pending settlements with it.
     * Pending rows are shared by all members, so the plan is built from every expense of the trip.
     */
    public SettlementSummary reconcileSettlements(UUID tripId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TRIP_ID_MDC_KEY, tripId.toString());
        try {
            SettlementSummary summary = tripLock.callWithLock(tripId, () -> {
                CurrencyCode baseCurrency = resolveBaseCurrency(tripId);
                List<Settlement> settlements = settlementStore.findByTrip(tripId);
                BalanceSheet sheet = aggregate(tripId, null, baseCurrency, settlements);

                List<TransferProposal> plan = settlementOptimizer.optimize(sheet.getBalances(), baseCurrency);
                ReconciliationResult result = settlementLedger.reconcile(tripId, baseCurrency, plan);
                metrics.recordReconciled(result.hasChanges());

                return toSummary(tripId, sheet, result.getPendingSettlements(), settlements);
            });

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLatency("reconcile", duration);
            log.info("Reconciliation finished: pending={}, duration={}ms",
                    summary.getPendingSettlements().size(), duration);
            return summary;
        } finally {
            MDC.remove(CorrelationContext.TRIP_ID_MDC_KEY);
        }
    }

    /**
     * Marks a settlement as paid on behalf of {@code actorId}. Repeating the call on a settled
     * row succeeds without changing it.
     *
     * @throws NotFoundException if the settlement does not exist
     * @throws com.flagship.trip_settlement.common.exception.AuthorizationException if the actor is not allowed
     */
    public Settlement markSettlementAsPaid(UUID settlementId, UUID actorId, String note) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.SETTLEMENT_ID_MDC_KEY, settlementId.toString());
        try {
            Settlement settlement = settlementStore.findById(settlementId)
                    .orElseThrow(() -> NotFoundException.settlement(settlementId));
            MDC.put(CorrelationContext.TRIP_ID_MDC_KEY, settlement.getTripId().toString());

            settlementAuthorizer.checkCanMarkPaid(settlement, actorId);

            MarkPaidResult result = tripLock.callWithLock(settlement.getTripId(),
                    () -> settlementLedger.markAsPaid(settlementId, actorId, note));

            metrics.recordMarkedPaid(result.isTransitioned());
            metrics.recordLatency("mark_paid", System.currentTimeMillis() - startTime);
            return result.getSettlement();
        } finally {
            MDC.remove(CorrelationContext.SETTLEMENT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRIP_ID_MDC_KEY);
        }
    }

    private CurrencyCode resolveBaseCurrency(UUID tripId) {
        return tripDirectory.findBaseCurrency(tripId)
                .orElseThrow(() -> NotFoundException.trip(tripId));
    }

    private BalanceSheet aggregate(UUID tripId, UUID viewerId, CurrencyCode baseCurrency, List<Settlement> settlements) {
        List<Settlement> settled = settlements.stream().filter(Settlement::isSettled).toList();
        return balanceAggregator.aggregate(tripId, expenseSource.findExpensesForTrip(tripId, viewerId),
                baseCurrency, settled);
    }

    private SettlementSummary toSummary(UUID tripId, BalanceSheet sheet, List<Settlement> pending,
                                        List<Settlement> settlements) {
        return new SettlementSummary(
            tripId,
            sheet.getBaseCurrency(),
            sheet.getBalances(),
            pending,
            settlements.stream().filter(Settlement::isSettled).toList(),
            sheet.getTotalExpensesUsed(),
            sheet.getExcludedExpenseIds()
        );
    }
}

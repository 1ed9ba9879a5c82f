package com.flagship.trip_settlement.balance;

import com.flagship.trip_settlement.expense.Expense;
import com.flagship.trip_settlement.fx.CurrencyCode;
import com.flagship.trip_settlement.fx.CurrencyNormalizer;
import com.flagship.trip_settlement.fx.NormalizedExpense;
import com.flagship.trip_settlement.settlement.Settlement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Folds a trip's expenses into one net balance per participant.
 *
 * For every convertible expense the payer is credited the converted total and every share holder
 * is debited their converted share. Settled transfers are then applied so that money already
 * handed over is not asked for again. Expenses without a usable rate are skipped and reported.
 *
 * The balances must net to zero; at most one minor unit of drift per currency conversion is
 * tolerated and anything beyond that raises {@link BalanceDriftException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceAggregator {

    static final Comparator<UserBalance> CREDITORS_FIRST = Comparator
        .comparingLong(UserBalance::getNetBalance).reversed()
        .thenComparing(balance -> balance.getUserId().toString());

    private final CurrencyNormalizer currencyNormalizer;

    public BalanceSheet aggregate(UUID tripId, List<Expense> expenses, CurrencyCode baseCurrency,
                                  List<Settlement> settledSettlements) {
        Map<UUID, Long> net = new LinkedHashMap<>();
        List<UUID> excluded = new ArrayList<>();
        int used = 0;
        int conversions = 0;

        for (Expense expense : expenses) {
            NormalizedExpense normalized = currencyNormalizer.normalize(expense, baseCurrency);
            if (normalized.isNeedsConversion()) {
                excluded.add(expense.getId());
                continue;
            }

            used++;
            if (normalized.isConverted()) {
                conversions++;
            }

            net.merge(normalized.getPayerId(), normalized.getConvertedAmount(), Long::sum);
            for (NormalizedExpense.NormalizedShare share : normalized.getShares()) {
                net.merge(share.getUserId(), -share.getAmount(), Long::sum);
            }
        }

        for (Settlement settlement : settledSettlements) {
            if (!settlement.isSettled()) {
                continue;
            }
            if (!baseCurrency.equals(settlement.getCurrency())) {
                log.warn("Skipping settled settlement {} in {}: trip base currency is {}",
                        settlement.getId(), settlement.getCurrency(), baseCurrency);
                continue;
            }
            net.merge(settlement.getFromUserId(), settlement.getAmount(), Long::sum);
            net.merge(settlement.getToUserId(), -settlement.getAmount(), Long::sum);
        }

        long drift = net.values().stream().mapToLong(Long::longValue).sum();
        if (Math.abs(drift) > conversions) {
            log.error("Balance drift detected for trip {}: drift={}, conversions={}", tripId, drift, conversions);
            throw new BalanceDriftException(tripId, drift, conversions);
        }

        List<UserBalance> balances = new ArrayList<>(net.size());
        net.forEach((userId, amount) -> balances.add(new UserBalance(userId, amount, baseCurrency)));
        balances.sort(CREDITORS_FIRST);

        if (!excluded.isEmpty()) {
            log.warn("Excluded {} expenses without FX rate from trip {} balances", excluded.size(), tripId);
        }
        log.debug("Aggregated {} expenses into {} balances for trip {} ({} conversions)",
                used, balances.size(), tripId, conversions);

        return new BalanceSheet(baseCurrency, List.copyOf(balances), List.copyOf(excluded), used, conversions);
    }
}

package com.flagship.trip_settlement.fx;

import com.flagship.trip_settlement.expense.Expense;
import com.flagship.trip_settlement.expense.Share;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts one expense and its shares into the trip's base currency using the expense's rate snapshot.
 *
 * Conversion rounds half-up to whole minor units. Shares are converted on their running total
 * ({@code round(prefix_i * rate) - round(prefix_(i-1) * rate)}) so that the converted shares always
 * add up to the converted expense amount. An expense without a usable rate or currency is flagged, not rejected.
 */
@Component
@Slf4j
public class CurrencyNormalizer {

    public NormalizedExpense normalize(Expense expense, CurrencyCode baseCurrency) {
        if (expense.getCurrency() == null) {
            log.warn("Expense {} has no recognisable currency, excluding it from balances", expense.getId());
            return NormalizedExpense.unconvertible(expense.getId(), expense.getPayerId(), baseCurrency);
        }

        if (expense.getCurrency().equals(baseCurrency)) {
            List<NormalizedExpense.NormalizedShare> shares = new ArrayList<>(expense.getShares().size());
            for (Share share : expense.getShares()) {
                shares.add(new NormalizedExpense.NormalizedShare(share.getUserId(), share.getShareAmount()));
            }
            return new NormalizedExpense(expense.getId(), expense.getPayerId(), baseCurrency,
                    expense.getAmount(), BigDecimal.ONE, false, false, shares);
        }

        BigDecimal rate = expense.getFxRateToBase();
        if (rate == null || rate.signum() <= 0) {
            log.warn("No usable FX rate for expense {} ({} -> {}), excluding it from balances",
                    expense.getId(), expense.getCurrency(), baseCurrency);
            return NormalizedExpense.unconvertible(expense.getId(), expense.getPayerId(), baseCurrency);
        }

        long convertedAmount = convert(expense.getAmount(), rate);

        List<NormalizedExpense.NormalizedShare> shares = new ArrayList<>(expense.getShares().size());
        long prefix = 0;
        long convertedPrefix = 0;
        for (Share share : expense.getShares()) {
            prefix += share.getShareAmount();
            long convertedRunning = convert(prefix, rate);
            shares.add(new NormalizedExpense.NormalizedShare(share.getUserId(), convertedRunning - convertedPrefix));
            convertedPrefix = convertedRunning;
        }

        log.debug("Converted expense {}: {} {} -> {} {} at rate {}",
                expense.getId(), expense.getAmount(), expense.getCurrency(), convertedAmount, baseCurrency, rate);

        return new NormalizedExpense(expense.getId(), expense.getPayerId(), baseCurrency,
                convertedAmount, rate, true, false, shares);
    }

    /**
     * Converts an amount of minor units with the given rate, rounding half-up.
     */
    public static long convert(long minorUnits, BigDecimal rate) {
        return BigDecimal.valueOf(minorUnits)
            .multiply(rate)
            .setScale(0, RoundingMode.HALF_UP)
            .longValueExact();
    }
}

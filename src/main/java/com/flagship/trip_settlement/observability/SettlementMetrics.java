package com.flagship.trip_settlement.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for settlement computation and lifecycle.
 *
 * <ul>
 *   <li>{@code settlement.summary.computed}: summaries served</li>
 *   <li>{@code settlement.reconciled}: reconciliation runs, tagged by whether rows changed</li>
 *   <li>{@code settlement.marked_paid}: mark-paid calls, tagged {@code transitioned} or {@code already_settled}</li>
 *   <li>{@code settlement.fx.excluded}: expenses left out for lack of an FX rate</li>
 *   <li>{@code settlement.latency}: operation latency, tagged by operation</li>
 * </ul>
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;
    private final Counter summariesComputed;
    private final Counter expensesExcluded;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.summariesComputed = Counter.builder("settlement.summary.computed")
                .description("Number of settlement summaries computed")
                .register(registry);

        this.expensesExcluded = Counter.builder("settlement.fx.excluded")
                .description("Expenses excluded from balances because no FX rate was available")
                .register(registry);
    }

    public void recordSummaryComputed(int excludedExpenses) {
        summariesComputed.increment();
        if (excludedExpenses > 0) {
            expensesExcluded.increment(excludedExpenses);
        }
    }

    public void recordReconciled(boolean changed) {
        registry.counter("settlement.reconciled", "changed", String.valueOf(changed)).increment();
    }

    public void recordMarkedPaid(boolean transitioned) {
        registry.counter("settlement.marked_paid",
                "result", transitioned ? "transitioned" : "already_settled"
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("settlement.latency")
                .description("Latency of settlement operations")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }
}

package com.flagship.trip_settlement.settlement;

import com.flagship.trip_settlement.access.PartyOnlySettlementAuthorizer;
import com.flagship.trip_settlement.balance.BalanceAggregator;
import com.flagship.trip_settlement.balance.UserBalance;
import com.flagship.trip_settlement.common.exception.AuthorizationException;
import com.flagship.trip_settlement.common.exception.NotFoundException;
import com.flagship.trip_settlement.expense.Expense;
import com.flagship.trip_settlement.fx.CurrencyCode;
import com.flagship.trip_settlement.fx.CurrencyNormalizer;
import com.flagship.trip_settlement.observability.SettlementMetrics;
import com.flagship.trip_settlement.outbox.OutboxService;
import com.flagship.trip_settlement.support.InMemoryExpenseSource;
import com.flagship.trip_settlement.support.InMemorySettlementStore;
import com.flagship.trip_settlement.support.InMemoryTripLock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.flagship.trip_settlement.support.Expenses.expense;
import static com.flagship.trip_settlement.support.Expenses.inBase;
import static com.flagship.trip_settlement.support.TestOutput.printExpectedException;
import static com.flagship.trip_settlement.support.TestOutput.printOutput;
import static com.flagship.trip_settlement.support.TestOutput.printSuccess;
import static com.flagship.trip_settlement.support.TestOutput.printTestHeader;
import static com.flagship.trip_settlement.support.TestUsers.ALICE;
import static com.flagship.trip_settlement.support.TestUsers.BOB;
import static com.flagship.trip_settlement.support.TestUsers.CAROL;
import static com.flagship.trip_settlement.support.TestUsers.DAVE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class SettlementServiceTest {

    private static final UUID TRIP = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    private InMemorySettlementStore store;
    private InMemoryExpenseSource expenses;
    private SimpleMeterRegistry registry;
    private SettlementService service;

    @BeforeEach
    void setUp() {
        store = new InMemorySettlementStore();
        expenses = new InMemoryExpenseSource();
        registry = new SimpleMeterRegistry();

        SettlementLedger ledger = new SettlementLedger(store, mock(OutboxService.class), Clock.fixed(NOW, ZoneOffset.UTC));
        service = new SettlementService(
                tripId -> TRIP.equals(tripId) ? Optional.of(CurrencyCode.USD) : Optional.empty(),
                expenses,
                store,
                new BalanceAggregator(new CurrencyNormalizer()),
                new SettlementOptimizer(),
                ledger,
                new PartyOnlySettlementAuthorizer(),
                new InMemoryTripLock(Set.of(TRIP)),
                new SettlementMetrics(registry));

        expenses.add(inBase(TRIP, ALICE, 9000, CurrencyCode.USD, ALICE, 3000, BOB, 3000, CAROL, 3000));
    }

    @Test
    @DisplayName("Summary reports balances but no pending rows before the first reconciliation")
    void summaryBeforeReconcile() {
        printTestHeader("Service - Summary");

        SettlementSummary summary = service.computeSettlementSummary(TRIP, ALICE);
        printOutput("Balances", summary.getBalances());

        assertEquals(CurrencyCode.USD, summary.getBaseCurrency());
        assertEquals(6000, summary.getBalances().get(0).getNetBalance());
        assertTrue(summary.getPendingSettlements().isEmpty());
        assertEquals(1, summary.getTotalExpensesUsed());
        assertEquals(1.0, registry.counter("settlement.summary.computed").count());
        assertTrue(store.all().isEmpty(), "Summary must not write");
        printSuccess("Summary is read-only");
    }

    @Test
    @DisplayName("Full lifecycle: reconcile, pay one transfer, reconcile again")
    void lifecycle() {
        printTestHeader("Service - Lifecycle");

        SettlementSummary reconciled = service.reconcileSettlements(TRIP);
        printOutput("Pending", reconciled.getPendingSettlements());
        assertEquals(2, reconciled.getPendingSettlements().size());

        Settlement bobToAlice = reconciled.getPendingSettlements().stream()
                .filter(s -> s.getFromUserId().equals(BOB))
                .findFirst()
                .orElseThrow();

        Settlement paid = service.markSettlementAsPaid(bobToAlice.getId(), BOB, "bank transfer");
        assertEquals(SettlementStatus.SETTLED, paid.getStatus());

        SettlementSummary after = service.reconcileSettlements(TRIP);
        printOutput("Balances after payment", after.getBalances());

        assertEquals(1, after.getPendingSettlements().size());
        assertEquals(CAROL, after.getPendingSettlements().get(0).getFromUserId());
        assertEquals(3000, after.getPendingSettlements().get(0).getAmount());
        assertEquals(List.of(paid), after.getSettledSettlements());
        assertEquals(0, after.getBalances().stream()
                .filter(b -> b.getUserId().equals(BOB)).mapToLong(UserBalance::getNetBalance).sum());
        printSuccess("Paid transfer kept as history and excluded from the new plan");
    }

    @Test
    @DisplayName("Expense without FX rate is listed as excluded in the summary")
    void excludedExpenseInSummary() {
        Expense taxi = expense(TRIP, BOB, 2000, CurrencyCode.EUR, null, ALICE, 1000, BOB, 1000);
        expenses.add(taxi);

        SettlementSummary summary = service.computeSettlementSummary(TRIP, ALICE);

        assertEquals(List.of(taxi.getId()), summary.getExcludedExpenseIds());
        assertEquals(1.0, registry.counter("settlement.fx.excluded").count());
    }

    @Test
    @DisplayName("Converted expense is included once a rate is present")
    void convertedExpenseIncluded() {
        expenses.add(expense(TRIP, DAVE, 2000, CurrencyCode.EUR, new BigDecimal("1.10"), ALICE, 1000, DAVE, 1000));

        SettlementSummary summary = service.computeSettlementSummary(TRIP, ALICE);

        assertEquals(2, summary.getTotalExpensesUsed());
        assertEquals(1100, summary.getBalances().stream()
                .filter(b -> b.getUserId().equals(DAVE)).mapToLong(UserBalance::getNetBalance).sum());
    }

    @Test
    @DisplayName("Expense in a currency outside the common set is converted like any other")
    void anyIsoCurrencyConverted() {
        expenses.add(expense(TRIP, DAVE, 20000, CurrencyCode.parse("KRW"), new BigDecimal("0.075"),
                ALICE, 10000, DAVE, 10000));

        SettlementSummary summary = service.computeSettlementSummary(TRIP, ALICE);

        assertEquals(2, summary.getTotalExpensesUsed());
        assertTrue(summary.getExcludedExpenseIds().isEmpty());
        assertEquals(750, summary.getBalances().stream()
                .filter(b -> b.getUserId().equals(DAVE)).mapToLong(UserBalance::getNetBalance).sum());
    }

    @Test
    @DisplayName("Expense with an unrecognised currency is excluded and the rest of the trip still settles")
    void unrecognisedCurrencyExcluded() {
        Expense unknownCurrency = expense(TRIP, BOB, 2000, null, new BigDecimal("0.9"), ALICE, 1000, BOB, 1000);
        expenses.add(unknownCurrency);

        SettlementSummary summary = service.reconcileSettlements(TRIP);

        assertEquals(List.of(unknownCurrency.getId()), summary.getExcludedExpenseIds());
        assertEquals(1, summary.getTotalExpensesUsed());
        assertEquals(2, summary.getPendingSettlements().size());
    }

    @Test
    @DisplayName("Summary counts only the caller's visible expenses while reconcile uses the whole trip")
    void summaryScopedToViewer() {
        printTestHeader("Service - Viewer Scope");
        Expense privateExpense = inBase(TRIP, BOB, 3000, CurrencyCode.USD, ALICE, 1500, BOB, 1500);
        expenses.add(privateExpense);
        expenses.hideFrom(CAROL, privateExpense);

        SettlementSummary carolView = service.computeSettlementSummary(TRIP, CAROL);
        SettlementSummary aliceView = service.computeSettlementSummary(TRIP, ALICE);
        SettlementSummary reconciled = service.reconcileSettlements(TRIP);
        printOutput("Carol balances", carolView.getBalances());

        assertEquals(1, carolView.getTotalExpensesUsed());
        assertEquals(2, aliceView.getTotalExpensesUsed());
        assertEquals(2, reconciled.getTotalExpensesUsed());
        assertEquals(4500, aliceView.getBalances().stream()
                .filter(b -> b.getUserId().equals(ALICE)).mapToLong(UserBalance::getNetBalance).sum());
        printSuccess("Visibility applied to summaries only");
    }

    @Test
    @DisplayName("Unknown trip is reported as not found")
    void unknownTrip() {
        UUID unknown = UUID.randomUUID();

        assertThrows(NotFoundException.class, () -> service.computeSettlementSummary(unknown, ALICE));
        NotFoundException e = assertThrows(NotFoundException.class, () -> service.reconcileSettlements(unknown));
        printExpectedException("NotFoundException", e.getMessage());
    }

    @Test
    @DisplayName("Unknown settlement is reported as not found")
    void unknownSettlement() {
        assertThrows(NotFoundException.class,
                () -> service.markSettlementAsPaid(UUID.randomUUID(), ALICE, null));
    }

    @Test
    @DisplayName("Only a party to the settlement may mark it paid")
    void outsiderCannotMarkPaid() {
        Settlement pending = service.reconcileSettlements(TRIP).getPendingSettlements().get(0);

        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> service.markSettlementAsPaid(pending.getId(), DAVE, null));

        printExpectedException("AuthorizationException", e.getMessage());
        assertEquals(SettlementStatus.PENDING, store.findById(pending.getId()).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Repeated mark-paid returns the settled row unchanged")
    void markPaidRepeated() {
        Settlement pending = service.reconcileSettlements(TRIP).getPendingSettlements().get(0);
        Settlement first = service.markSettlementAsPaid(pending.getId(), pending.getToUserId(), "cash");

        Settlement second = service.markSettlementAsPaid(pending.getId(), pending.getFromUserId(), "again");

        assertEquals(first, second);
        assertEquals(1.0, registry.counter("settlement.marked_paid", "result", "transitioned").count());
        assertEquals(1.0, registry.counter("settlement.marked_paid", "result", "already_settled").count());
    }

    @Test
    @DisplayName("Concurrent reconciliations of one trip never leave duplicate pending rows")
    void concurrentReconcile() throws Exception {
        printTestHeader("Service - Concurrent Reconcile");
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SettlementSummary>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return service.reconcileSettlements(TRIP);
                }));
            }
            start.countDown();
            for (Future<SettlementSummary> future : futures) {
                assertEquals(2, future.get(10, TimeUnit.SECONDS).getPendingSettlements().size());
            }
        } finally {
            executor.shutdownNow();
        }

        List<Settlement> rows = store.all();
        printOutput("Rows", rows.size());
        assertEquals(2, rows.size());
        assertEquals(2, rows.stream().map(s -> s.getFromUserId() + "->" + s.getToUserId()).distinct().count());
        printSuccess("Exactly one pending row per pair");
    }
}

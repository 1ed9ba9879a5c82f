package com.flagship.trip_settlement.settlement;

import com.flagship.trip_settlement.balance.UserBalance;
import com.flagship.trip_settlement.fx.CurrencyCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

import static com.flagship.trip_settlement.support.TestOutput.printInput;
import static com.flagship.trip_settlement.support.TestOutput.printOutput;
import static com.flagship.trip_settlement.support.TestOutput.printSuccess;
import static com.flagship.trip_settlement.support.TestOutput.printTestHeader;
import static com.flagship.trip_settlement.support.TestUsers.ALICE;
import static com.flagship.trip_settlement.support.TestUsers.BOB;
import static com.flagship.trip_settlement.support.TestUsers.CAROL;
import static com.flagship.trip_settlement.support.TestUsers.DAVE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettlementOptimizerTest {

    private final SettlementOptimizer optimizer = new SettlementOptimizer();

    @Test
    @DisplayName("Two debtors pay the single creditor")
    void twoDebtorsOneCreditor() {
        printTestHeader("Optimizer - Three Way Dinner");

        List<UserBalance> balances = List.of(
                usd(ALICE, 6000),
                usd(BOB, -3000),
                usd(CAROL, -3000));
        printInput("Balances", balances);

        List<TransferProposal> plan = optimizer.optimize(balances, CurrencyCode.USD);
        printOutput("Plan", plan);

        assertEquals(List.of(
                new TransferProposal(BOB, ALICE, 3000, CurrencyCode.USD),
                new TransferProposal(CAROL, ALICE, 3000, CurrencyCode.USD)), plan);
        printSuccess("Plan is minimal and ordered by user id on ties");
    }

    @Test
    @DisplayName("Largest debtor is matched with largest creditor first")
    void largestFirst() {
        List<UserBalance> balances = List.of(
                usd(ALICE, 5000),
                usd(BOB, 2000),
                usd(CAROL, -6000),
                usd(DAVE, -1000));

        List<TransferProposal> plan = optimizer.optimize(balances, CurrencyCode.USD);

        assertEquals(List.of(
                new TransferProposal(CAROL, ALICE, 5000, CurrencyCode.USD),
                new TransferProposal(CAROL, BOB, 1000, CurrencyCode.USD),
                new TransferProposal(DAVE, BOB, 1000, CurrencyCode.USD)), plan);
    }

    @Test
    @DisplayName("Settled-up trip produces an empty plan")
    void allZero() {
        List<TransferProposal> plan = optimizer.optimize(
                List.of(usd(ALICE, 0), usd(BOB, 0)), CurrencyCode.USD);

        assertTrue(plan.isEmpty());
        assertTrue(optimizer.optimize(List.of(), CurrencyCode.USD).isEmpty());
    }

    @Test
    @DisplayName("A single minor unit is still owed and still transferred")
    void singleMinorUnitSettled() {
        List<TransferProposal> plan = optimizer.optimize(
                List.of(usd(ALICE, 1), usd(BOB, -1)), CurrencyCode.USD);

        assertEquals(List.of(new TransferProposal(BOB, ALICE, 1, CurrencyCode.USD)), plan);
    }

    @Test
    @DisplayName("Plan uses the requested currency")
    void currencyCarried() {
        List<TransferProposal> plan = optimizer.optimize(
                List.of(usd(ALICE, 100), usd(BOB, -100)), CurrencyCode.JPY);

        assertEquals(CurrencyCode.JPY, plan.get(0).getCurrency());
    }

    @Test
    @DisplayName("Random balances settle completely in at most N-1 positive transfers")
    void randomBalancesSettle() {
        printTestHeader("Optimizer - Random Balances");
        Random random = new Random(42);

        for (int run = 0; run < 500; run++) {
            int users = 2 + random.nextInt(10);
            List<UserBalance> balances = new ArrayList<>();
            long sum = 0;
            for (int i = 0; i < users - 1; i++) {
                long net = random.nextInt(200_001) - 100_000;
                balances.add(usd(UUID.randomUUID(), net));
                sum += net;
            }
            balances.add(usd(UUID.randomUUID(), -sum));

            List<TransferProposal> plan = optimizer.optimize(balances, CurrencyCode.USD);

            long nonZero = balances.stream().filter(b -> b.getNetBalance() != 0).count();
            assertTrue(plan.size() <= Math.max(0, nonZero - 1), "Too many transfers: " + plan.size());

            Map<UUID, Long> remaining = new HashMap<>();
            balances.forEach(b -> remaining.put(b.getUserId(), b.getNetBalance()));
            for (TransferProposal transfer : plan) {
                assertTrue(transfer.getAmount() > 0);
                assertNotEquals(transfer.getFromUserId(), transfer.getToUserId());
                remaining.merge(transfer.getFromUserId(), transfer.getAmount(), Long::sum);
                remaining.merge(transfer.getToUserId(), -transfer.getAmount(), Long::sum);
            }
            remaining.values().forEach(value -> assertEquals(0L, value));
        }
        printSuccess("500 random trips settled");
    }

    @Test
    @DisplayName("Same balances in a different order give the same plan")
    void deterministic() {
        List<UserBalance> balances = List.of(usd(ALICE, 4000), usd(BOB, 4000), usd(CAROL, -4000), usd(DAVE, -4000));
        List<UserBalance> reversed = new ArrayList<>(balances);
        Collections.reverse(reversed);

        assertEquals(optimizer.optimize(balances, CurrencyCode.USD), optimizer.optimize(reversed, CurrencyCode.USD));
    }

    private static UserBalance usd(UUID userId, long net) {
        return new UserBalance(userId, net, CurrencyCode.USD);
    }
}

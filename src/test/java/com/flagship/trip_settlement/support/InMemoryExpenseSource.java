package com.flagship.trip_settlement.support;

import com.flagship.trip_settlement.expense.Expense;
import com.flagship.trip_settlement.expense.ExpenseSource;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ExpenseSource} where individual expenses can be hidden from individual viewers.
 * A null viewer sees everything.
 */
public class InMemoryExpenseSource implements ExpenseSource {

    private final List<Expense> expenses = new CopyOnWriteArrayList<>();
    private final Map<UUID, Set<UUID>> hiddenByViewer = new ConcurrentHashMap<>();

    public void add(Expense expense) {
        expenses.add(expense);
    }

    public void hideFrom(UUID viewerId, Expense expense) {
        hiddenByViewer.computeIfAbsent(viewerId, id -> ConcurrentHashMap.newKeySet()).add(expense.getId());
    }

    @Override
    public List<Expense> findExpensesForTrip(UUID tripId, UUID viewerId) {
        Set<UUID> hidden = viewerId == null ? Set.of() : hiddenByViewer.getOrDefault(viewerId, Set.of());
        return expenses.stream()
                .filter(e -> e.getTripId().equals(tripId))
                .filter(e -> !hidden.contains(e.getId()))
                .toList();
    }
}

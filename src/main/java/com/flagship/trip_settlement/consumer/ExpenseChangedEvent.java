package com.flagship.trip_settlement.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event emitted by the expense service whenever an expense of a trip is created, edited or deleted.
 */
@Value
public class ExpenseChangedEvent {
    UUID eventId;
    String eventType;
    UUID expenseId;
    UUID tripId;
    Instant occurredAt;

    public static final String EXPENSE_CREATED = "ExpenseCreated";
    public static final String EXPENSE_UPDATED = "ExpenseUpdated";
    public static final String EXPENSE_DELETED = "ExpenseDeleted";

    public static boolean isExpenseChange(String eventType) {
        return EXPENSE_CREATED.equals(eventType)
                || EXPENSE_UPDATED.equals(eventType)
                || EXPENSE_DELETED.equals(eventType);
    }
}

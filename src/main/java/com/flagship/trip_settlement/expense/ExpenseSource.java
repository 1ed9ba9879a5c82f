package com.flagship.trip_settlement.expense;

import java.util.List;
import java.util.UUID;

/**
 * Read access to the expenses recorded for a trip.
 */
public interface ExpenseSource {

    /**
     * Returns the trip's expenses that {@code viewerId} may see, with their shares, oldest first.
     * Shares of one expense are ordered by user id.
     *
     * @param viewerId the calling user, or null for system callers that need every expense of the trip
     */
    List<Expense> findExpensesForTrip(UUID tripId, UUID viewerId);
}

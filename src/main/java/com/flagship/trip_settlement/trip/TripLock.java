package com.flagship.trip_settlement.trip;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Serializes writes to a trip's settlements.
 *
 * Reconciliation and mark-paid run inside this lock; summary reads never take it.
 */
public interface TripLock {

    /**
     * Runs {@code action} while holding the trip's lock and returns its result.
     *
     * @throws com.flagship.trip_settlement.common.exception.NotFoundException if the trip does not exist
     */
    <T> T callWithLock(UUID tripId, Supplier<T> action);
}

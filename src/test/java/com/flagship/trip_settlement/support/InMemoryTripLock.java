package com.flagship.trip_settlement.support;

import com.flagship.trip_settlement.common.exception.NotFoundException;
import com.flagship.trip_settlement.trip.TripLock;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * {@link TripLock} with one JVM lock per known trip.
 */
public class InMemoryTripLock implements TripLock {

    private final Set<UUID> knownTrips;
    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    public InMemoryTripLock(Set<UUID> knownTrips) {
        this.knownTrips = knownTrips;
    }

    @Override
    public <T> T callWithLock(UUID tripId, Supplier<T> action) {
        if (!knownTrips.contains(tripId)) {
            throw NotFoundException.trip(tripId);
        }
        ReentrantLock lock = locks.computeIfAbsent(tripId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}

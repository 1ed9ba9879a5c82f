package com.flagship.trip_settlement.trip;

import com.flagship.trip_settlement.common.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link TripLock} backed by a row lock on {@code trips}.
 *
 * The action runs in the same transaction that holds {@code SELECT ... FOR UPDATE}, so the lock
 * covers every instance of the service and is released when the transaction commits or rolls back.
 * When called inside an existing transaction the lock joins it and lives until that one ends.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DatabaseTripLock implements TripLock {

    private static final String LOCK_TRIP = "SELECT id FROM trips WHERE id = ? FOR UPDATE";

    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;

    @Override
    public <T> T callWithLock(UUID tripId, Supplier<T> action) {
        return transactionTemplate.execute(status -> {
            long start = System.currentTimeMillis();
            List<UUID> locked = jdbcTemplate.queryForList(LOCK_TRIP, UUID.class, tripId);
            if (locked.isEmpty()) {
                throw NotFoundException.trip(tripId);
            }
            log.debug("Acquired lock on trip {} in {}ms", tripId, System.currentTimeMillis() - start);
            return action.get();
        });
    }
}

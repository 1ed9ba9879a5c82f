package com.flagship.trip_settlement.settlement;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read/write access to settlement rows.
 *
 * Writes only ever touch PENDING rows; settled history is read-only.
 */
public interface SettlementStore {

    /**
     * All settlements of a trip, oldest first.
     */
    List<Settlement> findByTrip(UUID tripId);

    Optional<Settlement> findById(UUID settlementId);

    Settlement insert(Settlement settlement);

    /**
     * Re-prices a pending row.
     *
     * @return false if the row is no longer pending
     */
    boolean updateAmount(UUID settlementId, long amount, Instant now);

    /**
     * @return false if the row is no longer pending
     */
    boolean deletePending(UUID settlementId);

    /**
     * Conditionally moves a pending row to SETTLED.
     *
     * @return true if this call performed the transition, false if the row was not pending
     */
    boolean markSettled(UUID settlementId, UUID actorId, String note, Instant now);
}

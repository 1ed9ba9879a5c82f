package com.flagship.trip_settlement.settlement;

import lombok.Value;

import java.util.List;

/**
 * Outcome of replacing a trip's pending settlements with a fresh transfer plan.
 */
@Value
public class ReconciliationResult {
    int created;
    int updated;
    int unchanged;
    int removed;
    List<Settlement> pendingSettlements;

    public boolean hasChanges() {
        return created + updated + removed > 0;
    }
}

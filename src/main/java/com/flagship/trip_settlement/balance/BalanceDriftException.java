package com.flagship.trip_settlement.balance;

import java.util.UUID;

/**
 * Raised when aggregated balances do not net to zero within the rounding tolerance.
 * Indicates inconsistent expense data or a conversion defect and is never absorbed.
 */
public class BalanceDriftException extends IllegalStateException {

    public BalanceDriftException(UUID tripId, long drift, int tolerance) {
        super(String.format("Balances for trip %s drift by %d minor units (tolerance %d)", tripId, drift, tolerance));
    }
}

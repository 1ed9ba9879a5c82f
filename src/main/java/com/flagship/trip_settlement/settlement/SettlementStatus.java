package com.flagship.trip_settlement.settlement;

/**
 * Settlement lifecycle. PENDING is the only non-terminal state.
 */
public enum SettlementStatus {
    PENDING,
    SETTLED
}

package com.flagship.trip_settlement.settlement;

import lombok.Value;

/**
 * Settlement state after a mark-paid call. {@code transitioned} is false when the row was already settled.
 */
@Value
public class MarkPaidResult {
    Settlement settlement;
    boolean transitioned;
}

package com.flagship.trip_settlement.expense;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One participant's portion of one expense, in the expense's own currency.
 *
 * Invariant (per expense): the share amounts add up exactly to the expense amount.
 * {@code shareValue} keeps what the user originally entered (percentage, weight or
 * custom amount) and is null for equal splits.
 */
@Value
public class Share {
    UUID expenseId;
    UUID userId;
    long shareAmount;
    SplitType shareType;
    BigDecimal shareValue;

    /**
     * Creates a share that is not yet attached to a stored expense.
     */
    public static Share unattached(UUID userId, long shareAmount, SplitType shareType, BigDecimal shareValue) {
        return new Share(null, userId, shareAmount, shareType, shareValue);
    }
}

package com.flagship.trip_settlement.expense;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rule used to divide one expense's total among its participants.
 *
 * The lower-case value is what the API accepts and what is stored in
 * {@code expense_participants.share_type}.
 */
public enum SplitType {
    /**
     * Total divided evenly; the first participant absorbs the remainder.
     */
    EQUAL("equal"),

    /**
     * Each participant carries a percentage; the last participant absorbs rounding.
     */
    PERCENTAGE("percentage"),

    /**
     * Each participant carries an explicit amount in minor units; amounts must add up to the total.
     */
    AMOUNT("amount"),

    /**
     * Each participant carries a weight (e.g. 2 shares vs 1 share); the last participant absorbs rounding.
     */
    SHARES("shares");

    private final String value;

    SplitType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SplitType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SplitType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown split type: " + value);
    }
}

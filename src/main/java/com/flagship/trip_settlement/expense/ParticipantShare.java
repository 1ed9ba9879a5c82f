package com.flagship.trip_settlement.expense;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Input to the share calculator: a participant and the optional value they entered
 * (percentage, weight or custom amount depending on the split type).
 */
@Value
public class ParticipantShare {
    UUID userId;
    BigDecimal shareValue;

    public static ParticipantShare of(UUID userId) {
        return new ParticipantShare(userId, null);
    }

    public static ParticipantShare of(UUID userId, long shareValue) {
        return new ParticipantShare(userId, BigDecimal.valueOf(shareValue));
    }

    public static ParticipantShare of(UUID userId, BigDecimal shareValue) {
        return new ParticipantShare(userId, shareValue);
    }
}

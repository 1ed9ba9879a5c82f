package com.flagship.trip_settlement.settlement;

import com.flagship.trip_settlement.fx.CurrencyCode;
import lombok.Value;

import java.util.UUID;

/**
 * One edge of a computed transfer plan: the debtor pays the creditor {@code amount} minor units.
 */
@Value
public class TransferProposal {
    UUID fromUserId;
    UUID toUserId;
    long amount;
    CurrencyCode currency;

    PartyPair pair() {
        return new PartyPair(fromUserId, toUserId);
    }

    /**
     * Identity of a pending settlement within a trip.
     */
    record PartyPair(UUID fromUserId, UUID toUserId) {
    }
}

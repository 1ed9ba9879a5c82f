package com.flagship.trip_settlement.access;

import com.flagship.trip_settlement.settlement.Settlement;

import java.util.UUID;

/**
 * Decides whether a user may act on a settlement.
 */
public interface SettlementAuthorizer {

    /**
     * @throws com.flagship.trip_settlement.common.exception.AuthorizationException if {@code actorId}
     *         may not mark the settlement as paid
     */
    void checkCanMarkPaid(Settlement settlement, UUID actorId);
}

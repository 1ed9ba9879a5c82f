package com.flagship.trip_settlement.access;

import com.flagship.trip_settlement.common.exception.AuthorizationException;
import com.flagship.trip_settlement.settlement.Settlement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Only the payer or the payee of a settlement may mark it as paid.
 */
@Component
@Slf4j
public class PartyOnlySettlementAuthorizer implements SettlementAuthorizer {

    @Override
    public void checkCanMarkPaid(Settlement settlement, UUID actorId) {
        if (actorId == null || !settlement.involves(actorId)) {
            log.warn("User {} is not a party to settlement {}", actorId, settlement.getId());
            throw new AuthorizationException(
                "Only the payer or the payee can mark settlement " + settlement.getId() + " as paid");
        }
    }
}

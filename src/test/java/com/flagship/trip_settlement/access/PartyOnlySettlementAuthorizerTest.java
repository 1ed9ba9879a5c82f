package com.flagship.trip_settlement.access;

import com.flagship.trip_settlement.common.exception.AuthorizationException;
import com.flagship.trip_settlement.fx.CurrencyCode;
import com.flagship.trip_settlement.settlement.Settlement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static com.flagship.trip_settlement.support.TestUsers.ALICE;
import static com.flagship.trip_settlement.support.TestUsers.BOB;
import static com.flagship.trip_settlement.support.TestUsers.CAROL;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PartyOnlySettlementAuthorizerTest {

    private final PartyOnlySettlementAuthorizer authorizer = new PartyOnlySettlementAuthorizer();
    private final Settlement settlement = Settlement.pending(UUID.randomUUID(), BOB, ALICE, 3000,
            CurrencyCode.USD, Instant.parse("2026-03-02T12:00:00Z"));

    @Test
    @DisplayName("Payer and payee may mark the settlement paid")
    void partiesAllowed() {
        assertDoesNotThrow(() -> authorizer.checkCanMarkPaid(settlement, BOB));
        assertDoesNotThrow(() -> authorizer.checkCanMarkPaid(settlement, ALICE));
    }

    @Test
    @DisplayName("Other trip members and anonymous callers are refused")
    void othersRefused() {
        assertThrows(AuthorizationException.class, () -> authorizer.checkCanMarkPaid(settlement, CAROL));
        assertThrows(AuthorizationException.class, () -> authorizer.checkCanMarkPaid(settlement, null));
    }
}

package com.flagship.trip_settlement.settlement;

import com.flagship.trip_settlement.settlement.dto.MarkSettlementPaidRequest;
import com.flagship.trip_settlement.settlement.dto.SettlementResponse;
import com.flagship.trip_settlement.settlement.dto.SettlementSummaryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST surface for trip balances and settlements. The caller is identified by {@code X-User-Id}.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    static final String USER_ID_HEADER = "X-User-Id";

    private final SettlementService settlementService;

    @GetMapping("/trips/{tripId}/settlements/summary")
    public ResponseEntity<SettlementSummaryResponse> getSummary(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(USER_ID_HEADER) UUID userId) {
        return ResponseEntity.ok(SettlementSummaryResponse.from(
                settlementService.computeSettlementSummary(tripId, userId)));
    }

    @PostMapping("/trips/{tripId}/settlements/reconcile")
    public ResponseEntity<SettlementSummaryResponse> reconcile(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(USER_ID_HEADER) UUID userId) {
        log.info("Reconciliation requested by user {}", userId);
        return ResponseEntity.ok(SettlementSummaryResponse.from(settlementService.reconcileSettlements(tripId)));
    }

    /**
     * Marks a settlement as paid. Safe to repeat: a settled row is returned unchanged.
     */
    @PostMapping("/settlements/{settlementId}/mark-paid")
    public ResponseEntity<SettlementResponse> markPaid(
            @PathVariable("settlementId") UUID settlementId,
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @Valid @RequestBody(required = false) MarkSettlementPaidRequest request) {
        String note = request != null ? request.getNote() : null;
        log.info("Mark-paid requested by user {}", userId);

        Settlement settlement = settlementService.markSettlementAsPaid(settlementId, userId, note);
        return ResponseEntity.ok(SettlementResponse.from(settlement));
    }
}

package com.flagship.trip_settlement.expense;

import com.flagship.trip_settlement.expense.dto.CalculateSharesRequest;
import com.flagship.trip_settlement.expense.dto.ShareResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Stateless share preview used by expense forms before an expense is saved.
 */
@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
@Slf4j
public class ExpenseShareController {

    private final ShareCalculator shareCalculator;

    @PostMapping("/shares")
    public ResponseEntity<List<ShareResponse>> calculateShares(@Valid @RequestBody CalculateSharesRequest request) {
        log.info("Calculating shares: totalAmount={}, splitType={}, participants={}",
                request.getTotalAmount(), request.getSplitType().getValue(), request.getParticipants().size());

        List<ParticipantShare> participants = request.getParticipants().stream()
            .map(p -> ParticipantShare.of(p.getUserId(), p.getShareValue()))
            .toList();

        List<Share> shares = shareCalculator.calculateShares(
            request.getTotalAmount(), request.getSplitType(), participants);

        return ResponseEntity.ok(shares.stream().map(ShareResponse::from).toList());
    }
}

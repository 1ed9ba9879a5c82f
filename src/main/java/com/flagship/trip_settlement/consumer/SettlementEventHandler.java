package com.flagship.trip_settlement.consumer;

import com.flagship.trip_settlement.settlement.SettlementService;
import com.flagship.trip_settlement.settlement.event.SettlementSettledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Business reactions to events, called only after the idempotency check has passed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementEventHandler {

    private final SettlementService settlementService;

    /**
     * An expense changed, so the trip's transfer plan may be stale.
     */
    public void onExpenseChanged(ExpenseChangedEvent event) {
        log.info("Handling {}: expenseId={}, tripId={}", event.getEventType(), event.getExpenseId(), event.getTripId());
        settlementService.reconcileSettlements(event.getTripId());
    }

    /**
     * Produces the notification intent for the other party of a settled transfer.
     * Delivery belongs to the notification service.
     */
    public void onSettlementSettled(SettlementSettledEvent event) {
        UUID recipient = event.getSettledBy() != null && event.getSettledBy().equals(event.getToUserId())
                ? event.getFromUserId()
                : event.getToUserId();

        log.info("Notify user {}: settlement {} of {} {} from {} to {} marked as paid by {}",
                recipient,
                event.getSettlementId(),
                event.getAmount(),
                event.getCurrency(),
                event.getFromUserId(),
                event.getToUserId(),
                event.getSettledBy());
    }
}

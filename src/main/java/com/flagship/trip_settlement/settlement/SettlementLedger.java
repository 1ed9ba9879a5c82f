package com.flagship.trip_settlement.settlement;

import com.flagship.trip_settlement.common.exception.NotFoundException;
import com.flagship.trip_settlement.common.exception.ValidationException;
import com.flagship.trip_settlement.fx.CurrencyCode;
import com.flagship.trip_settlement.outbox.OutboxService;
import com.flagship.trip_settlement.settlement.event.SettlementSettledEvent;
import com.flagship.trip_settlement.settlement.event.SettlementsReconciledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists transfer plans as settlement rows and drives their PENDING to SETTLED lifecycle.
 *
 * Callers hold the trip lock around both operations. Settled rows are history: reconciliation
 * reads them but never updates or deletes them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementLedger {

    public static final int NOTE_MAX_LENGTH = 500;

    private final SettlementStore store;
    private final OutboxService outboxService;
    private final Clock clock;

    /**
     * Replaces the trip's pending rows with {@code plan}, matching rows by (from, to) pair.
     *
     * A matching pair keeps its id and is re-priced if needed, pairs missing from the plan are
     * deleted and new pairs are inserted. Pending rows in another currency than the plan are
     * treated as missing.
     */
    @Transactional
    public ReconciliationResult reconcile(UUID tripId, CurrencyCode currency, List<TransferProposal> plan) {
        Instant now = clock.instant();

        Map<TransferProposal.PartyPair, Settlement> existing = new LinkedHashMap<>();
        List<Settlement> stale = new ArrayList<>();
        for (Settlement settlement : store.findByTrip(tripId)) {
            if (settlement.isSettled()) {
                continue;
            }
            TransferProposal.PartyPair pair =
                new TransferProposal.PartyPair(settlement.getFromUserId(), settlement.getToUserId());
            if (!settlement.getCurrency().equals(currency) || existing.putIfAbsent(pair, settlement) != null) {
                stale.add(settlement);
            }
        }

        int created = 0;
        int updated = 0;
        int unchanged = 0;
        int removed = 0;
        List<Settlement> pending = new ArrayList<>(plan.size());

        // stale rows may share a pair with a row about to be inserted
        removed += deleteAll(tripId, stale);

        for (TransferProposal proposal : plan) {
            Settlement current = existing.remove(proposal.pair());
            if (current == null) {
                pending.add(store.insert(Settlement.pending(tripId, proposal.getFromUserId(),
                        proposal.getToUserId(), proposal.getAmount(), currency, now)));
                created++;
            } else if (current.getAmount() == proposal.getAmount()) {
                pending.add(current);
                unchanged++;
            } else if (store.updateAmount(current.getId(), proposal.getAmount(), now)) {
                pending.add(current.withAmount(proposal.getAmount(), now));
                updated++;
            } else {
                log.warn("Settlement {} left PENDING during reconciliation of trip {}, not re-pricing it",
                        current.getId(), tripId);
            }
        }

        removed += deleteAll(tripId, existing.values());

        ReconciliationResult result = new ReconciliationResult(created, updated, unchanged, removed, List.copyOf(pending));

        if (result.hasChanges()) {
            outboxService.saveEvent(OutboxService.AGGREGATE_TRIP, tripId, SettlementsReconciledEvent.EVENT_TYPE,
                    new SettlementsReconciledEvent(UUID.randomUUID(), tripId, currency.getCode(),
                            created, updated, removed, pending.size(), now));
        }

        log.info("Reconciled settlements: created={}, updated={}, unchanged={}, removed={}",
                created, updated, unchanged, removed);
        return result;
    }

    /**
     * Moves a settlement to SETTLED, stamping the acting user and the current time.
     * A settlement that is already settled is returned as is.
     *
     * @throws NotFoundException if the settlement does not exist
     * @throws ValidationException if the note is too long
     */
    @Transactional
    public MarkPaidResult markAsPaid(UUID settlementId, UUID actorId, String note) {
        String normalizedNote = normalizeNote(note);

        Settlement settlement = store.findById(settlementId)
                .orElseThrow(() -> NotFoundException.settlement(settlementId));

        if (settlement.isSettled()) {
            log.info("Settlement already settled, nothing to do");
            return new MarkPaidResult(settlement, false);
        }

        Instant now = clock.instant();
        if (!store.markSettled(settlementId, actorId, normalizedNote, now)) {
            Optional<Settlement> reread = store.findById(settlementId);
            if (reread.isPresent() && reread.get().isSettled()) {
                return new MarkPaidResult(reread.get(), false);
            }
            throw NotFoundException.settlement(settlementId);
        }

        Settlement settled = settlement.markSettled(actorId, normalizedNote, now);
        outboxService.saveEvent(OutboxService.AGGREGATE_SETTLEMENT, settled.getId(),
                SettlementSettledEvent.EVENT_TYPE, SettlementSettledEvent.fromSettlement(settled));

        log.info("Settlement marked as paid: amount={}, currency={}, settledBy={}",
                settled.getAmount(), settled.getCurrency(), actorId);
        return new MarkPaidResult(settled, true);
    }

    private int deleteAll(UUID tripId, Iterable<Settlement> settlements) {
        int deleted = 0;
        for (Settlement settlement : settlements) {
            if (store.deletePending(settlement.getId())) {
                deleted++;
            } else {
                log.warn("Settlement {} left PENDING during reconciliation of trip {}, keeping it",
                        settlement.getId(), tripId);
            }
        }
        return deleted;
    }

    static String normalizeNote(String note) {
        if (note == null || note.isBlank()) {
            return null;
        }
        String trimmed = note.trim();
        if (trimmed.length() > NOTE_MAX_LENGTH) {
            throw new ValidationException("Note must be at most " + NOTE_MAX_LENGTH + " characters");
        }
        return trimmed;
    }
}

package com.flagship.trip_settlement.settlement;

import com.flagship.trip_settlement.balance.UserBalance;
import com.flagship.trip_settlement.fx.CurrencyCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.UUID;

/**
 * Greedy debt netting: repeatedly lets the largest debtor pay the largest creditor.
 *
 * Each transfer zeroes at least one party, so N non-zero balances settle in at most N-1 transfers.
 * Equal magnitudes are ordered by user id so the plan is reproducible. Balances are netted down to
 * zero: a single minor unit is real money and still gets a transfer.
 */
@Component
@Slf4j
public class SettlementOptimizer {

    private static final Comparator<Position> LARGEST_FIRST = Comparator
        .comparingLong(Position::magnitude).reversed()
        .thenComparing(position -> position.userId.toString());

    public List<TransferProposal> optimize(List<UserBalance> balances, CurrencyCode currency) {
        PriorityQueue<Position> creditors = new PriorityQueue<>(LARGEST_FIRST);
        PriorityQueue<Position> debtors = new PriorityQueue<>(LARGEST_FIRST);

        for (UserBalance balance : balances) {
            if (balance.isCreditor()) {
                creditors.add(new Position(balance.getUserId(), balance.getNetBalance()));
            } else if (balance.isDebtor()) {
                debtors.add(new Position(balance.getUserId(), -balance.getNetBalance()));
            }
        }

        List<TransferProposal> transfers = new ArrayList<>();
        while (!creditors.isEmpty() && !debtors.isEmpty()) {
            Position creditor = creditors.poll();
            Position debtor = debtors.poll();

            long amount = Math.min(creditor.remaining, debtor.remaining);
            transfers.add(new TransferProposal(debtor.userId, creditor.userId, amount, currency));

            creditor.remaining -= amount;
            debtor.remaining -= amount;

            if (creditor.remaining > 0) {
                creditors.add(creditor);
            }
            if (debtor.remaining > 0) {
                debtors.add(debtor);
            }
        }

        if (!creditors.isEmpty() || !debtors.isEmpty()) {
            // only reachable with rounding drift left over from conversions
            log.debug("Unmatched residue after netting: creditors={}, debtors={}", creditors.size(), debtors.size());
        }

        log.debug("Optimized {} balances into {} transfers", balances.size(), transfers.size());
        return transfers;
    }

    private static final class Position {
        private final UUID userId;
        private long remaining;

        private Position(UUID userId, long remaining) {
            this.userId = userId;
            this.remaining = remaining;
        }

        private long magnitude() {
            return remaining;
        }
    }
}

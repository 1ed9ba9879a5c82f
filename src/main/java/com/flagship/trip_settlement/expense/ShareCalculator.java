package com.flagship.trip_settlement.expense;

import com.flagship.trip_settlement.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Splits one expense total among its participants.
 *
 * All arithmetic is on integer minor units. Every rule reconstructs the total exactly:
 * <ul>
 *   <li>equal: {@code floor(total / n)} each, the first participant also takes the remainder</li>
 *   <li>percentage: {@code floor(total * pct / 100)} for all but the last participant,
 *       who takes whatever is left</li>
 *   <li>shares: {@code floor(total * weight / sumOfWeights)} for all but the last participant,
 *       who takes whatever is left</li>
 *   <li>amount: values are passed through once they add up to the total</li>
 * </ul>
 * Input order is significant and preserved in the output, which keeps splits reproducible.
 */
@Component
@Slf4j
public class ShareCalculator {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    /**
     * Calculates the shares for one expense.
     *
     * @param totalAmount expense total in minor units, must be positive
     * @param splitType split rule
     * @param participants participants in input order
     * @return one share per participant, in input order, summing exactly to {@code totalAmount}
     * @throws ValidationException if the input cannot produce a valid split
     */
    public List<Share> calculateShares(long totalAmount, SplitType splitType, List<ParticipantShare> participants) {
        if (totalAmount <= 0) {
            throw new ValidationException("Total amount must be positive");
        }
        if (splitType == null) {
            throw new ValidationException("Split type is required");
        }
        if (participants == null || participants.isEmpty()) {
            throw new ValidationException("At least one participant is required");
        }
        requireDistinctUsers(participants);

        List<Share> shares = switch (splitType) {
            case EQUAL -> splitEqually(totalAmount, participants);
            case PERCENTAGE -> splitByPercentage(totalAmount, participants);
            case AMOUNT -> splitByAmount(totalAmount, participants);
            case SHARES -> splitByWeight(totalAmount, participants);
        };

        log.debug("Split {} minor units {} among {} participants", totalAmount, splitType.getValue(), shares.size());
        return shares;
    }

    private List<Share> splitEqually(long totalAmount, List<ParticipantShare> participants) {
        int count = participants.size();
        long base = totalAmount / count;
        long remainder = totalAmount - base * count;

        List<Share> shares = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            long amount = i == 0 ? base + remainder : base;
            shares.add(Share.unattached(participants.get(i).getUserId(), amount, SplitType.EQUAL, null));
        }
        return shares;
    }

    private List<Share> splitByPercentage(long totalAmount, List<ParticipantShare> participants) {
        BigDecimal percentageTotal = BigDecimal.ZERO;
        for (ParticipantShare participant : participants) {
            BigDecimal percentage = requireValue(participant, "percentage");
            if (percentage.signum() < 0) {
                throw new ValidationException("Percentage must not be negative for participant " + participant.getUserId());
            }
            percentageTotal = percentageTotal.add(percentage);
        }
        if (percentageTotal.compareTo(ONE_HUNDRED) != 0) {
            throw new ValidationException(
                String.format("Percentages must add up to 100, got %s", percentageTotal.stripTrailingZeros().toPlainString()));
        }

        BigDecimal total = BigDecimal.valueOf(totalAmount);
        return distributeWithLastRemainder(totalAmount, participants, SplitType.PERCENTAGE,
                percentage -> total.multiply(percentage).divide(ONE_HUNDRED, 0, RoundingMode.FLOOR).longValueExact());
    }

    private List<Share> splitByWeight(long totalAmount, List<ParticipantShare> participants) {
        BigDecimal weightTotal = BigDecimal.ZERO;
        for (ParticipantShare participant : participants) {
            BigDecimal weight = requireValue(participant, "share weight");
            if (weight.signum() <= 0) {
                throw new ValidationException("Share weight must be positive for participant " + participant.getUserId());
            }
            weightTotal = weightTotal.add(weight);
        }

        BigDecimal total = BigDecimal.valueOf(totalAmount);
        BigDecimal sumOfWeights = weightTotal;
        return distributeWithLastRemainder(totalAmount, participants, SplitType.SHARES,
                weight -> total.multiply(weight).divide(sumOfWeights, 0, RoundingMode.FLOOR).longValueExact());
    }

    private List<Share> splitByAmount(long totalAmount, List<ParticipantShare> participants) {
        List<Share> shares = new ArrayList<>(participants.size());
        long sum = 0;
        for (ParticipantShare participant : participants) {
            BigDecimal value = requireValue(participant, "amount");
            long amount;
            try {
                amount = value.longValueExact();
            } catch (ArithmeticException e) {
                throw new ValidationException(
                    "Amount must be a whole number of minor units for participant " + participant.getUserId(), e);
            }
            if (amount < 0) {
                throw new ValidationException("Amount must not be negative for participant " + participant.getUserId());
            }
            sum = Math.addExact(sum, amount);
            shares.add(Share.unattached(participant.getUserId(), amount, SplitType.AMOUNT, value));
        }

        if (sum != totalAmount) {
            throw new ValidationException(
                String.format("Custom amounts add up to %d but the expense total is %d", sum, totalAmount));
        }
        return shares;
    }

    private List<Share> distributeWithLastRemainder(long totalAmount, List<ParticipantShare> participants,
                                                    SplitType splitType, ShareFormula formula) {
        List<Share> shares = new ArrayList<>(participants.size());
        long runningSum = 0;
        int last = participants.size() - 1;

        for (int i = 0; i < last; i++) {
            ParticipantShare participant = participants.get(i);
            long amount = formula.apply(participant.getShareValue());
            runningSum += amount;
            shares.add(Share.unattached(participant.getUserId(), amount, splitType, participant.getShareValue()));
        }

        ParticipantShare lastParticipant = participants.get(last);
        shares.add(Share.unattached(lastParticipant.getUserId(), totalAmount - runningSum, splitType,
                lastParticipant.getShareValue()));
        return shares;
    }

    private BigDecimal requireValue(ParticipantShare participant, String label) {
        if (participant.getShareValue() == null) {
            throw new ValidationException("Missing " + label + " for participant " + participant.getUserId());
        }
        return participant.getShareValue();
    }

    private void requireDistinctUsers(List<ParticipantShare> participants) {
        Set<UUID> seen = new HashSet<>();
        for (ParticipantShare participant : participants) {
            if (participant == null || participant.getUserId() == null) {
                throw new ValidationException("Participant user id is required");
            }
            if (!seen.add(participant.getUserId())) {
                throw new ValidationException("Participant listed more than once: " + participant.getUserId());
            }
        }
    }

    @FunctionalInterface
    private interface ShareFormula {
        long apply(BigDecimal shareValue);
    }
}

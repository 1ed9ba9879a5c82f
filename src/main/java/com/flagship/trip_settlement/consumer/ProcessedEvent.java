package com.flagship.trip_settlement.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an event. Each group keeps its own records,
 * so the reconciler and the notifier can both consume the same event once.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED     // not relevant to this consumer group
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant processedAt) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                processedAt, ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant processedAt,
                                         String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                processedAt, ProcessingResult.SKIPPED, reason);
    }
}

package com.flagship.trip_settlement.outbox;

import com.flagship.trip_settlement.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

/**
 * Moves settlement events from the outbox to the {@code settlements} topic.
 *
 * The record key is the aggregate id (trip or settlement), so consumers see one aggregate's events
 * in outbox order. Once an event of an aggregate fails, the rest of that aggregate's events in the
 * batch wait for the next poll. An event that has failed {@code max-retries} times is left in the
 * table as a dead letter.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.settlements:settlements}")
    private String settlementsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findUnpublishedEvents(batchSize);
        } catch (RuntimeException e) {
            log.error("Could not read the outbox, will retry on the next poll", e);
            return;
        }
        if (batch.isEmpty()) {
            return;
        }

        Set<UUID> held = new HashSet<>();
        int published = 0;
        for (OutboxEvent event : batch) {
            if (held.contains(event.getAggregateId())) {
                continue;
            }
            if (event.getRetryCount() >= maxRetries) {
                log.warn("Dead letter {} ({} for {} {}) after {} attempts: {}", event.getId(), event.getEventType(),
                        event.getAggregateType(), event.getAggregateId(), event.getRetryCount(), event.getLastError());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
                held.add(event.getAggregateId());
                continue;
            }
            if (send(event)) {
                published++;
            } else {
                held.add(event.getAggregateId());
            }
        }

        log.debug("Outbox poll: batch={}, published={}, heldAggregates={}", batch.size(), published, held.size());
    }

    private boolean send(OutboxEvent event) {
        String failure;
        try {
            RecordMetadata metadata = kafkaTemplate
                    .send(settlementsTopic, event.getAggregateId().toString(), event.getPayload())
                    .get()
                    .getRecordMetadata();

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Published {} {} to {}-{}@{}", event.getEventType(), event.getId(),
                    metadata.topic(), metadata.partition(), metadata.offset());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = "Interrupted while publishing";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            failure = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        } catch (RuntimeException e) {
            failure = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        log.error("Failed to publish {} {}: {}", event.getEventType(), event.getId(), failure);
        outboxService.markFailed(event.getId(), failure);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        return false;
    }
}

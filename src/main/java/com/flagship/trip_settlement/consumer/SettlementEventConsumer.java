package com.flagship.trip_settlement.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.trip_settlement.observability.CorrelationContext;
import com.flagship.trip_settlement.outbox.OutboxService;
import com.flagship.trip_settlement.settlement.event.SettlementSettledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Kafka listeners for expense changes and settlement events.
 *
 * Offsets are acknowledged manually after the handler (and its processed-event record) committed;
 * a failure leaves the record unacknowledged for redelivery.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SettlementEventConsumer {

    static final String RECONCILER_GROUP = "settlement-reconciler";
    static final String NOTIFIER_GROUP = "settlement-notifier";

    private final IdempotentEventProcessor eventProcessor;
    private final SettlementEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = "${kafka.topic.expense-events:expense-events}", groupId = RECONCILER_GROUP)
    public void consumeExpenseEvent(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received expense event: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        JsonNode node = readTree(record.value());
        if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("tripId")) {
            log.warn("Could not parse expense event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        UUID eventId = UUID.fromString(node.get("eventId").asText());
        UUID tripId = UUID.fromString(node.get("tripId").asText());
        String eventType = node.path("eventType").asText("Unknown");

        withEventContext(eventId, () -> {
            if (ExpenseChangedEvent.isExpenseChange(eventType)) {
                ExpenseChangedEvent event = deserialize(record.value(), ExpenseChangedEvent.class);
                eventProcessor.processEvent(eventId, eventType, OutboxService.AGGREGATE_TRIP, tripId,
                        RECONCILER_GROUP, () -> eventHandler.onExpenseChanged(event));
            } else {
                eventProcessor.skipEvent(eventId, eventType, OutboxService.AGGREGATE_TRIP, tripId,
                        RECONCILER_GROUP, "Not an expense change");
            }
        });
        ack.acknowledge();
    }

    @KafkaListener(topics = "${kafka.topic.settlements:settlements}", groupId = NOTIFIER_GROUP)
    public void consumeSettlementEvent(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received settlement event: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        JsonNode node = readTree(record.value());
        if (node == null || !node.hasNonNull("eventId")) {
            log.warn("Could not parse settlement event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        UUID eventId = UUID.fromString(node.get("eventId").asText());
        String eventType = node.path("eventType").asText("Unknown");

        withEventContext(eventId, () -> {
            if (SettlementSettledEvent.EVENT_TYPE.equals(eventType)) {
                SettlementSettledEvent event = deserialize(record.value(), SettlementSettledEvent.class);
                eventProcessor.processEvent(eventId, eventType, OutboxService.AGGREGATE_SETTLEMENT,
                        event.getSettlementId(), NOTIFIER_GROUP, () -> eventHandler.onSettlementSettled(event));
            } else {
                UUID aggregateId = node.hasNonNull("tripId") ? UUID.fromString(node.get("tripId").asText()) : eventId;
                eventProcessor.skipEvent(eventId, eventType, OutboxService.AGGREGATE_TRIP, aggregateId,
                        NOTIFIER_GROUP, "No notification for " + eventType);
            }
        });
        ack.acknowledge();
    }

    /**
     * Log lines of one event share its id as correlation id.
     */
    private void withEventContext(UUID eventId, Runnable action) {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, eventId.toString());
        try {
            action.run();
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse event payload: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}

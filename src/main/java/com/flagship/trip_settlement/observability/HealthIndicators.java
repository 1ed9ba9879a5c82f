package com.flagship.trip_settlement.observability;

import com.flagship.trip_settlement.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator checks for the settlement event pipeline.
 */
public class HealthIndicators {

    static final Status DEGRADED = new Status("DEGRADED");

    /**
     * Settlement events waiting in the outbox. Dead letters never leave the table on their own,
     * so any of them degrades the status until somebody looks at them.
     */
    @Component("settlementOutboxHealth")
    public static class SettlementOutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private final long degradedBacklog;
        private final long downBacklog;
        private final int maxRetries;

        public SettlementOutboxHealthIndicator(
                OutboxEventRepository outboxRepository,
                @Value("${outbox.health.degraded-backlog:1000}") long degradedBacklog,
                @Value("${outbox.health.down-backlog:10000}") long downBacklog,
                @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.degradedBacklog = degradedBacklog;
            this.downBacklog = downBacklog;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            long backlog;
            long deadLetters;
            try {
                backlog = outboxRepository.countUnpublished();
                deadLetters = outboxRepository.countDeadLettered(maxRetries);
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }

            Status status;
            if (backlog >= downBacklog) {
                status = Status.DOWN;
            } else if (backlog >= degradedBacklog || deadLetters > 0) {
                status = DEGRADED;
            } else {
                status = Status.UP;
            }

            return Health.status(status)
                    .withDetails(Map.of(
                            "unpublished", backlog,
                            "deadLettered", deadLetters,
                            "degradedBacklog", degradedBacklog,
                            "downBacklog", downBacklog))
                    .build();
        }
    }

    /**
     * The producer only reports metrics once it has connected, so an empty metric map means the
     * outbox publisher cannot reach the broker.
     */
    @Component("settlementKafkaHealth")
    public static class SettlementKafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;
        private final String settlementsTopic;

        public SettlementKafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate,
                                              @Value("${kafka.topic.settlements:settlements}") String settlementsTopic) {
            this.kafkaTemplate = kafkaTemplate;
            this.settlementsTopic = settlementsTopic;
        }

        @Override
        public Health health() {
            Health.Builder builder;
            try {
                int producerMetrics = kafkaTemplate.metrics().size();
                builder = producerMetrics > 0
                        ? Health.up().withDetail("producerMetrics", producerMetrics)
                        : Health.down().withDetail("reason", "Producer has not connected to the broker");
            } catch (RuntimeException e) {
                builder = Health.down(e);
            }
            return builder.withDetail("topic", settlementsTopic).build();
        }
    }
}

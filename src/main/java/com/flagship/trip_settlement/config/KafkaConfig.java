package com.flagship.trip_settlement.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned or consumed by the settlement service. Partitioned by aggregate id.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.settlements:settlements}")
    private String settlementsTopic;

    @Value("${kafka.topic.expense-events:expense-events}")
    private String expenseEventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic settlementsTopic() {
        return TopicBuilder.name(settlementsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic expenseEventsTopic() {
        return TopicBuilder.name(expenseEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}

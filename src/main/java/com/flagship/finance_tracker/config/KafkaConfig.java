package com.flagship.finance_tracker.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics for ledger events.
 *
 * Invoice events and obligation events go to separate topics so that
 * consumers interested in card rollover do not have to filter the much
 * busier obligation stream.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.invoices:invoices}")
    private String invoicesTopic;

    @Value("${kafka.topic.obligations:obligations}")
    private String obligationsTopic;

    @Bean
    public NewTopic invoicesTopic() {
        return TopicBuilder.name(invoicesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic obligationsTopic() {
        return TopicBuilder.name(obligationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

package com.flagship.finance_tracker.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in (or already drained from) the outbox table.
 *
 * Written in the same transaction as the invoice or ledger change it
 * describes; published to Kafka later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(AggregateType aggregateType, UUID aggregateId,
                                     String eventType, String payload, String correlationId) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType.getLabel(),
            aggregateId,
            eventType,
            payload,
            correlationId,
            Instant.now(),
            null,
            0,
            null,
            null // assigned by the database sequence
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean hasExhaustedRetries(int maxRetries) {
        return retryCount >= maxRetries;
    }
}

package com.flagship.finance_tracker.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_tracker.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the outbox inside the caller's transaction.
 *
 * If the invoice close or ledger mutation commits, its event is stored; if
 * it rolls back, so does the event. Publishing to Kafka happens later in
 * {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Must run inside an existing transaction (MANDATORY), otherwise the
     * event could commit without the change it describes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(AggregateType aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType,
            serializePayload(payload), CorrelationContext.getCorrelationId());

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));
        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
            eventType, aggregateType.getLabel(), aggregateId);
        return saved.toDomain();
    }

    /**
     * Row locks are released when this returns, before anything is sent.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishable(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(AggregateType aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                aggregateType.getLabel(), aggregateId).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    @Transactional
    public int purgePublishedBefore(Instant before) {
        int deleted = repository.deletePublishedBefore(before);
        if (deleted > 0) {
            log.info("Purged {} published outbox events older than {}", deleted, before);
        }
        return deleted;
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}

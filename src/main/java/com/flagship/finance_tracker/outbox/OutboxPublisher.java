package com.flagship.finance_tracker.outbox;

import com.flagship.finance_tracker.observability.CorrelationContext;
import com.flagship.finance_tracker.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Drains the outbox table into Kafka.
 *
 * Events are sent one by one and acknowledged before being marked
 * published, keyed by aggregate id so that all events of one invoice (or
 * one ledger entry) land on the same partition in commit order. Failed
 * sends bump the retry count; rows at the retry limit stop being picked up.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.invoices:invoices}")
    private String invoicesTopic;

    @Value("${kafka.topic.obligations:obligations}")
    private String obligationsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.retention-days:7}")
    private int retentionDays;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishable(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    @Scheduled(cron = "${outbox.retention-cron:0 30 3 * * *}")
    public void purgePublishedEvents() {
        outboxService.purgePublishedBefore(Instant.now().minus(Duration.ofDays(retentionDays)));
    }

    private void publishEvent(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            topicFor(event), event.getAggregateId().toString(), event.getPayload());
        record.headers().add("eventType", event.getEventType().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get();
            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), leaving it for manual replay. eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(OutboxEvent event) {
        return switch (AggregateType.fromLabel(event.getAggregateType())) {
            case CREDIT_CARD_INVOICE -> invoicesTopic;
            case OBLIGATION_STATUS -> obligationsTopic;
        };
    }

    public void triggerPublish() {
        publishPendingEvents();
    }
}

package com.flagship.finance_tracker.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_tracker.card.CreditCard;
import com.flagship.finance_tracker.card.CreditCardService;
import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.invoice.AlreadyClosedException;
import com.flagship.finance_tracker.invoice.CreditCardInvoice;
import com.flagship.finance_tracker.invoice.InvoiceLifecycleService;
import com.flagship.finance_tracker.invoice.event.InvoiceOpenedEvent;
import com.flagship.finance_tracker.support.PostgresIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OutboxServiceTest extends PostgresIntegrationTest {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private CreditCardService creditCardService;

    @Autowired
    private InvoiceLifecycleService invoiceLifecycleService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private OutboxEvent saveInTransaction(UUID aggregateId) {
        return transactionTemplate.execute(status -> outboxService.saveEvent(
            AggregateType.OBLIGATION_STATUS, aggregateId, "TestEvent", Map.of("name", "test-value")));
    }

    @Test
    @DisplayName("Events are only written inside an existing transaction")
    void testSaveEvent_RequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.saveEvent(AggregateType.OBLIGATION_STATUS, UUID.randomUUID(), "TestEvent", Map.of()));
    }

    @Test
    @DisplayName("Saved events start unpublished with no retries")
    void testSaveEvent_CreatesCorrectEvent() throws Exception {
        UUID aggregateId = UUID.randomUUID();
        OutboxEvent event = saveInTransaction(aggregateId);

        assertEquals("ObligationStatus", event.getAggregateType());
        assertEquals(aggregateId, event.getAggregateId());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
        assertEquals("test-value", objectMapper.readTree(event.getPayload()).get("name").asText());
    }

    @Test
    @DisplayName("markPublished and markFailed update the stored row")
    void testMarkPublishedAndFailed() {
        OutboxEvent published = saveInTransaction(UUID.randomUUID());
        OutboxEvent failing = saveInTransaction(UUID.randomUUID());

        outboxService.markPublished(published.getId());
        outboxService.markFailed(failing.getId(), "Broker not available");
        outboxService.markFailed(failing.getId(), "Broker not available");

        assertNotNull(outboxEventRepository.findById(published.getId()).orElseThrow().getPublishedAt());
        OutboxEventEntity failed = outboxEventRepository.findById(failing.getId()).orElseThrow();
        assertNull(failed.getPublishedAt());
        assertEquals(2, failed.getRetryCount());
        assertEquals("Broker not available", failed.getLastError());
    }

    @Test
    @DisplayName("The opened invoice event carries the billing period")
    void testInvoiceOpenedEvent_IsWritten() throws Exception {
        CreditCard card = creditCardService.register(Country.PORTUGAL, CurrencyCode.EUR,
            BigDecimal.ZERO, BigDecimal.ZERO, "Outbox Tester", "2222");
        CreditCardInvoice invoice = invoiceLifecycleService.createInitialInvoice(card.getId(), LocalDate.of(2024, 2, 14));

        List<OutboxEvent> events = outboxService.getEventsForAggregate(AggregateType.CREDIT_CARD_INVOICE, invoice.getId());
        assertEquals(1, events.size());
        assertEquals(InvoiceOpenedEvent.EVENT_TYPE, events.get(0).getEventType());

        JsonNode payload = objectMapper.readTree(events.get(0).getPayload());
        assertEquals(invoice.getId().toString(), payload.get("invoiceId").asText());
        assertEquals("2024-02-01", payload.get("startDate").asText());
        assertEquals("2024-02-29", payload.get("endDate").asText());
    }

    @Test
    @DisplayName("A rejected close writes no event")
    void testRejectedOperation_WritesNoEvent() {
        CreditCard card = creditCardService.register(Country.PORTUGAL, CurrencyCode.EUR,
            BigDecimal.ZERO, BigDecimal.ZERO, "Outbox Tester", "3333");
        CreditCardInvoice invoice = invoiceLifecycleService.createInitialInvoice(card.getId(), LocalDate.of(2024, 5, 1));
        invoiceLifecycleService.close(invoice.getId());
        int before = outboxService.getEventsForAggregate(AggregateType.CREDIT_CARD_INVOICE, invoice.getId()).size();

        assertThrows(AlreadyClosedException.class, () -> invoiceLifecycleService.close(invoice.getId()));

        assertEquals(before, outboxService.getEventsForAggregate(AggregateType.CREDIT_CARD_INVOICE, invoice.getId()).size());
    }
}

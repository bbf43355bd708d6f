package com.flagship.finance_tracker.invoice.event;

import com.flagship.finance_tracker.invoice.InvoiceRollover;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when an invoice is closed. Carries the successor that was
 * opened in the same transaction, so consumers never observe a card
 * without an open invoice.
 */
@Value
public class InvoiceClosedEvent implements InvoiceEvent {
    UUID eventId;
    UUID invoiceId;
    UUID creditCardId;
    LocalDate closedStartDate;
    LocalDate closedEndDate;
    UUID successorInvoiceId;
    LocalDate successorStartDate;
    LocalDate successorEndDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InvoiceClosedEvent fromRollover(InvoiceRollover rollover) {
        var closed = rollover.getClosedInvoice();
        var successor = rollover.getSuccessor();
        return new InvoiceClosedEvent(
            UUID.randomUUID(),
            closed.getId(),
            closed.getCreditCardId(),
            closed.getPeriod().getStartDate(),
            closed.getPeriod().getEndDate(),
            successor.getId(),
            successor.getPeriod().getStartDate(),
            successor.getPeriod().getEndDate(),
            closed.getClosedAt() != null ? closed.getClosedAt() : Instant.now()
        );
    }
}

package com.flagship.finance_tracker.invoice.event;

import com.flagship.finance_tracker.invoice.CreditCardInvoice;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a card's first invoice is bootstrapped.
 * Successor invoices are announced by {@link InvoiceClosedEvent} instead.
 */
@Value
public class InvoiceOpenedEvent implements InvoiceEvent {
    UUID eventId;
    UUID invoiceId;
    UUID creditCardId;
    LocalDate startDate;
    LocalDate endDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceOpened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InvoiceOpenedEvent fromInvoice(CreditCardInvoice invoice) {
        return new InvoiceOpenedEvent(
            UUID.randomUUID(),
            invoice.getId(),
            invoice.getCreditCardId(),
            invoice.getPeriod().getStartDate(),
            invoice.getPeriod().getEndDate(),
            Instant.now()
        );
    }
}

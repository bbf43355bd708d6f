package com.flagship.finance_tracker.invoice.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Facts about an invoice's lifecycle, published through the outbox.
 */
public interface InvoiceEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getInvoiceId();

    UUID getCreditCardId();

    Instant getOccurredAt();

    String getEventType();
}

package com.flagship.finance_tracker.invoice;

import com.flagship.finance_tracker.billing.BillingPeriod;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Invoice of one credit card for one billing period.
 *
 * Immutable: {@link #close(Instant)} returns a new instance. The only
 * allowed transition is OPEN -> CLOSED and it is not repeatable.
 */
@Value
public class CreditCardInvoice {
    UUID id;
    UUID creditCardId;
    BillingPeriod period;
    boolean closed;
    Instant closedAt;

    public static CreditCardInvoice open(UUID id, UUID creditCardId, BillingPeriod period) {
        return new CreditCardInvoice(id, creditCardId, period, false, null);
    }

    /**
     * @throws AlreadyClosedException if this invoice is already closed
     */
    public CreditCardInvoice close(Instant closedAt) {
        if (closed) {
            throw new AlreadyClosedException(id);
        }
        return new CreditCardInvoice(id, creditCardId, period, true, closedAt);
    }

    public InvoiceState getState() {
        return closed ? InvoiceState.CLOSED : InvoiceState.OPEN;
    }

    public long getBillingPeriodDays() {
        return period.days();
    }
}

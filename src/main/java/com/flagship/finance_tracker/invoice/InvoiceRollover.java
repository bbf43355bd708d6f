package com.flagship.finance_tracker.invoice;

import lombok.Value;

/**
 * Outcome of a close: the invoice that was closed and the open invoice
 * that replaced it, committed together.
 */
@Value
public class InvoiceRollover {
    CreditCardInvoice closedInvoice;
    CreditCardInvoice successor;
}

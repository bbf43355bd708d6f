package com.flagship.finance_tracker.invoice;

import com.flagship.finance_tracker.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read-time aggregate over the ledger entries that reference an invoice.
 * Never persisted.
 */
@Value
public class InvoiceTotals {
    UUID invoiceId;
    BigDecimal totalAmount;
    CurrencyCode currency;
    long purchasesCount;
    long billingPeriodDays;
}

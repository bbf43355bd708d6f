package com.flagship.finance_tracker.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.invoice.InvoiceTotals;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class InvoiceTotalsResponse {

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("purchases_count")
    long purchasesCount;

    @JsonProperty("billing_period_days")
    long billingPeriodDays;

    public static InvoiceTotalsResponse from(InvoiceTotals totals) {
        return InvoiceTotalsResponse.builder()
            .invoiceId(totals.getInvoiceId())
            .totalAmount(totals.getTotalAmount())
            .currency(totals.getCurrency())
            .purchasesCount(totals.getPurchasesCount())
            .billingPeriodDays(totals.getBillingPeriodDays())
            .build();
    }
}

package com.flagship.finance_tracker.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.invoice.CreditCardInvoice;
import com.flagship.finance_tracker.invoice.InvoiceState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("credit_card_id")
    UUID creditCardId;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("state")
    InvoiceState state;

    @JsonProperty("closed_at")
    Instant closedAt;

    @JsonProperty("billing_period_days")
    long billingPeriodDays;

    public static InvoiceResponse from(CreditCardInvoice invoice) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .creditCardId(invoice.getCreditCardId())
            .startDate(invoice.getPeriod().getStartDate())
            .endDate(invoice.getPeriod().getEndDate())
            .state(invoice.getState())
            .closedAt(invoice.getClosedAt())
            .billingPeriodDays(invoice.getBillingPeriodDays())
            .build();
    }
}

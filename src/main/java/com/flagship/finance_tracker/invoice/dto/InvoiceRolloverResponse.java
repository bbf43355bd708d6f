package com.flagship.finance_tracker.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.invoice.InvoiceRollover;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InvoiceRolloverResponse {

    @JsonProperty("closed")
    InvoiceResponse closed;

    @JsonProperty("opened")
    InvoiceResponse opened;

    public static InvoiceRolloverResponse from(InvoiceRollover rollover) {
        return InvoiceRolloverResponse.builder()
            .closed(InvoiceResponse.from(rollover.getClosedInvoice()))
            .opened(InvoiceResponse.from(rollover.getSuccessor()))
            .build();
    }
}

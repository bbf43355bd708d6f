package com.flagship.finance_tracker.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Body of the initial-invoice bootstrap. The anchor is optional and
 * defaults to today.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OpenInvoiceRequest {

    @JsonProperty("anchor_date")
    private LocalDate anchorDate;
}

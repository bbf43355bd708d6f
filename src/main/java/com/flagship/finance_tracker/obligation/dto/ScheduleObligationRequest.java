package com.flagship.finance_tracker.obligation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.CurrencyCode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Exactly one of the three obligation ids must be set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleObligationRequest {

    @JsonProperty("fixed_payment_id")
    private UUID fixedPaymentId;

    @JsonProperty("variable_payment_id")
    private UUID variablePaymentId;

    @JsonProperty("invoice_id")
    private UUID invoiceId;

    @NotNull(message = "Month is required")
    @JsonProperty("month_year")
    private YearMonth monthYear;

    @NotNull(message = "Due date is required")
    @JsonProperty("due_date")
    private LocalDate dueDate;

    @NotNull(message = "Expected amount is required")
    @DecimalMin(value = "0.00", message = "Expected amount cannot be negative")
    @JsonProperty("expected_amount")
    private BigDecimal expectedAmount;

    @NotNull(message = "Currency is required")
    @JsonProperty("currency")
    private CurrencyCode currency;

    @JsonProperty("notes")
    private String notes;
}

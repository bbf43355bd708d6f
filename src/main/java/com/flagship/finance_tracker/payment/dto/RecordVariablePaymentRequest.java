package com.flagship.finance_tracker.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.payment.ExpenseCategory;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecordVariablePaymentRequest {

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    private LocalDate date;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    private String description;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than zero")
    @JsonProperty("amount")
    private BigDecimal amount;

    @NotNull(message = "Currency is required")
    @JsonProperty("currency")
    private CurrencyCode currency;

    @NotNull(message = "Country is required")
    @JsonProperty("country")
    private Country country;

    @NotNull(message = "Category is required")
    @JsonProperty("category")
    private ExpenseCategory category;

    @JsonProperty("credit_card_id")
    private UUID creditCardId;
}

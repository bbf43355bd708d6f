package com.flagship.finance_tracker.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.payment.PaymentFrequency;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateFixedPaymentRequest {

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

    @NotNull(message = "Frequency is required")
    @JsonProperty("frequency")
    private PaymentFrequency frequency;

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    private LocalDate startDate;

    @JsonProperty("end_date")
    private LocalDate endDate;
}

package com.flagship.finance_tracker.exchange.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.CurrencyCode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateExchangeRateRequest {

    @NotNull(message = "Source currency is required")
    @JsonProperty("from_currency")
    private CurrencyCode fromCurrency;

    @NotNull(message = "Target currency is required")
    @JsonProperty("to_currency")
    private CurrencyCode toCurrency;

    @NotNull(message = "Rate is required")
    @DecimalMin(value = "0.000001", message = "Rate must be greater than zero")
    @JsonProperty("rate")
    private BigDecimal rate;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    private LocalDate date;
}

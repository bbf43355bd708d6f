package com.flagship.finance_tracker.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.CurrencyCode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FinancialProfileRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    private String name;

    @NotNull(message = "Base currency is required")
    @JsonProperty("base_currency")
    private CurrencyCode baseCurrency;

    @DecimalMin(value = "0.00", message = "Income cannot be negative")
    @JsonProperty("monthly_income_brl")
    private BigDecimal monthlyIncomeBrl;

    @DecimalMin(value = "0.00", message = "Income cannot be negative")
    @JsonProperty("monthly_income_eur")
    private BigDecimal monthlyIncomeEur;
}

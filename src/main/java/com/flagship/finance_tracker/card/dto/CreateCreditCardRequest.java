package com.flagship.finance_tracker.card.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateCreditCardRequest {

    @NotNull(message = "Issuer country is required")
    @JsonProperty("issuer_country")
    private Country issuerCountry;

    @NotNull(message = "Currency is required")
    @JsonProperty("currency")
    private CurrencyCode currency;

    @NotNull(message = "FX fee percent is required")
    @DecimalMin(value = "0.00", message = "FX fee percent cannot be negative")
    @JsonProperty("fx_fee_percent")
    private BigDecimal fxFeePercent;

    @NotNull(message = "Tax percent is required")
    @DecimalMin(value = "0.00", message = "Tax percent cannot be negative")
    @JsonProperty("tax_percent")
    private BigDecimal taxPercent;

    @NotBlank(message = "Cardholder name is required")
    @JsonProperty("cardholder_name")
    private String cardholderName;

    @NotBlank(message = "Final digits are required")
    @Pattern(regexp = "^\\d{4}$", message = "Final digits must be exactly 4 digits")
    @JsonProperty("final_digits")
    private String finalDigits;
}

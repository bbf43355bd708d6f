package com.flagship.finance_tracker.card.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.card.CreditCard;
import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class CreditCardResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("issuer_country")
    Country issuerCountry;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("fx_fee_percent")
    BigDecimal fxFeePercent;

    @JsonProperty("tax_percent")
    BigDecimal taxPercent;

    @JsonProperty("cardholder_name")
    String cardholderName;

    @JsonProperty("final_digits")
    String finalDigits;

    @JsonProperty("is_active")
    boolean active;

    public static CreditCardResponse from(CreditCard card) {
        return CreditCardResponse.builder()
            .id(card.getId())
            .issuerCountry(card.getIssuerCountry())
            .currency(card.getCurrency())
            .fxFeePercent(card.getFxFeePercent())
            .taxPercent(card.getTaxPercent())
            .cardholderName(card.getCardholderName())
            .finalDigits(card.getFinalDigits())
            .active(card.isActive())
            .build();
    }
}

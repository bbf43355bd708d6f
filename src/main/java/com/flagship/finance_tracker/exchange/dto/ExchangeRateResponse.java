package com.flagship.finance_tracker.exchange.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.exchange.ExchangeRate;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class ExchangeRateResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("from_currency")
    CurrencyCode fromCurrency;

    @JsonProperty("to_currency")
    CurrencyCode toCurrency;

    @JsonProperty("rate")
    BigDecimal rate;

    @JsonProperty("date")
    LocalDate date;

    public static ExchangeRateResponse from(ExchangeRate rate) {
        return ExchangeRateResponse.builder()
            .id(rate.getId())
            .fromCurrency(rate.getFromCurrency())
            .toCurrency(rate.getToCurrency())
            .rate(rate.getRate())
            .date(rate.getRateDate())
            .build();
    }
}

package com.flagship.finance_tracker.exchange;

import com.flagship.finance_tracker.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Rate for converting one unit of {@code fromCurrency} into
 * {@code toCurrency} on {@code rateDate}. Only the stored direction is
 * used; the inverse is never derived.
 */
@Value
public class ExchangeRate {
    UUID id;
    CurrencyCode fromCurrency;
    CurrencyCode toCurrency;
    BigDecimal rate;
    LocalDate rateDate;

    public ExchangeRate(UUID id, CurrencyCode fromCurrency, CurrencyCode toCurrency,
                        BigDecimal rate, LocalDate rateDate) {
        if (fromCurrency == null || toCurrency == null || rateDate == null) {
            throw new IllegalArgumentException("Currencies and rate date are required");
        }
        if (fromCurrency == toCurrency) {
            throw new IllegalArgumentException("A rate needs two different currencies, got " + fromCurrency);
        }
        if (rate == null || rate.signum() <= 0) {
            throw new IllegalArgumentException("Rate must be positive");
        }
        this.id = id;
        this.fromCurrency = fromCurrency;
        this.toCurrency = toCurrency;
        this.rate = rate;
        this.rateDate = rateDate;
    }
}

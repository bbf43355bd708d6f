package com.flagship.finance_tracker.exchange;

import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.common.FinanceTrackerException;
import lombok.Getter;

import java.time.LocalDate;

/**
 * No stored rate satisfies the selection policy for the pair and date.
 */
@Getter
public class MissingRateException extends FinanceTrackerException {

    private final CurrencyCode fromCurrency;
    private final CurrencyCode toCurrency;
    private final LocalDate date;

    public MissingRateException(CurrencyCode fromCurrency, CurrencyCode toCurrency, LocalDate date) {
        super("No exchange rate " + fromCurrency + "->" + toCurrency + " for " + date);
        this.fromCurrency = fromCurrency;
        this.toCurrency = toCurrency;
        this.date = date;
    }
}

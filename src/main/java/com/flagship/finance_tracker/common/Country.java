package com.flagship.finance_tracker.common;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Countries where payments happen and cards are issued.
 */
@Getter
@RequiredArgsConstructor
public enum Country {
    BRAZIL(CurrencyCode.BRL, true),
    PORTUGAL(CurrencyCode.EUR, false);

    private final CurrencyCode homeCurrency;

    /**
     * Whether cards issued here are charged the IOF-style tax on
     * transactions outside the home currency.
     */
    private final boolean taxesForeignTransactions;
}

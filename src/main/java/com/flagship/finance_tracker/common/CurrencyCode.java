package com.flagship.finance_tracker.common;

/**
 * ISO-4217 currencies the tracker stores amounts in.
 *
 * Kept as an enum so that an unsupported currency is rejected at the
 * boundary instead of being stored and failing later during conversion.
 */
public enum CurrencyCode {
    BRL, // Brazilian Real
    EUR, // Euro
    USD  // US Dollar
}

package com.flagship.finance_tracker.card;

import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Credit card as seen by the billing core: only the attributes that drive
 * fees and invoice rollover.
 */
@Value
public class CreditCard {
    UUID id;
    Country issuerCountry;
    CurrencyCode currency;
    BigDecimal fxFeePercent;
    BigDecimal taxPercent;
    String cardholderName;
    String finalDigits;
    boolean active;

    /**
     * Home currency of the issuing country, which decides whether the
     * foreign-transaction tax applies.
     */
    public CurrencyCode getHomeCurrency() {
        return issuerCountry.getHomeCurrency();
    }
}

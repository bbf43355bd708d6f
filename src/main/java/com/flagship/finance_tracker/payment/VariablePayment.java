package com.flagship.finance_tracker.payment;

import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One-off expense. When paid with a card, the FX and tax fees are computed
 * once at record time and stored; later changes to the card's percentages
 * do not rewrite history.
 */
@Value
public class VariablePayment {
    UUID id;
    LocalDate date;
    String description;
    BigDecimal amount;
    CurrencyCode currency;
    Country country;
    ExpenseCategory category;
    UUID creditCardId;
    BigDecimal fxFeeAmount;
    BigDecimal taxFeeAmount;

    public boolean isCardPayment() {
        return creditCardId != null;
    }

    public BigDecimal getTotalFees() {
        return fxFeeAmount.add(taxFeeAmount);
    }

    public BigDecimal getTotalWithFees() {
        return amount.add(getTotalFees());
    }
}

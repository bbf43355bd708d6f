package com.flagship.finance_tracker.card;

import lombok.Value;

import java.math.BigDecimal;

/**
 * FX and tax fees of one transaction, kept apart for auditing.
 */
@Value
public class TransactionFees {
    BigDecimal amount;
    BigDecimal fxFee;
    BigDecimal taxFee;

    public static TransactionFees none(BigDecimal amount) {
        return new TransactionFees(amount, FeeCalculator.ZERO, FeeCalculator.ZERO);
    }

    public BigDecimal getTotalFees() {
        return fxFee.add(taxFee);
    }

    public BigDecimal getTotalWithFees() {
        return amount.add(fxFee).add(taxFee);
    }
}

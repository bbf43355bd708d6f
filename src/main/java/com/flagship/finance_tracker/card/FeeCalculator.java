package com.flagship.finance_tracker.card;

import com.flagship.finance_tracker.common.CurrencyCode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes the FX fee and the IOF-style tax fee of a card transaction.
 *
 * Both fees are percentages of the transaction amount. They are computed
 * independently (the tax is never charged on top of the FX fee) and each
 * is rounded to cents, HALF_UP.
 */
@Component
public class FeeCalculator {

    static final BigDecimal ZERO = new BigDecimal("0.00");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SCALE = 2;

    public TransactionFees fees(BigDecimal amount, CurrencyCode transactionCurrency, CreditCard card) {
        return new TransactionFees(
            amount,
            fxFee(amount, transactionCurrency, card),
            taxFee(amount, transactionCurrency, card)
        );
    }

    /**
     * Charged whenever the transaction currency differs from the card currency.
     */
    public BigDecimal fxFee(BigDecimal amount, CurrencyCode transactionCurrency, CreditCard card) {
        if (transactionCurrency == card.getCurrency()) {
            return ZERO;
        }
        return percentOf(amount, card.getFxFeePercent());
    }

    /**
     * Charged only by issuers whose country taxes foreign transactions, and
     * only when the transaction is outside that country's home currency.
     */
    public BigDecimal taxFee(BigDecimal amount, CurrencyCode transactionCurrency, CreditCard card) {
        if (!card.getIssuerCountry().isTaxesForeignTransactions()) {
            return ZERO;
        }
        if (transactionCurrency == card.getHomeCurrency()) {
            return ZERO;
        }
        return percentOf(amount, card.getTaxPercent());
    }

    private BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        if (percent == null || percent.signum() == 0) {
            return ZERO;
        }
        return amount.multiply(percent)
            .divide(HUNDRED, SCALE, RoundingMode.HALF_UP);
    }
}

package com.flagship.finance_tracker.profile;

import com.flagship.finance_tracker.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Owner of the tracked finances: the reporting currency and the monthly
 * income received in each home currency.
 */
@Value
public class FinancialProfile {
    UUID id;
    String name;
    CurrencyCode baseCurrency;
    BigDecimal monthlyIncomeBrl;
    BigDecimal monthlyIncomeEur;

    public FinancialProfile(UUID id, String name, CurrencyCode baseCurrency,
                            BigDecimal monthlyIncomeBrl, BigDecimal monthlyIncomeEur) {
        if (baseCurrency != CurrencyCode.BRL && baseCurrency != CurrencyCode.EUR) {
            throw new IllegalArgumentException("Base currency must be BRL or EUR, got " + baseCurrency);
        }
        if (monthlyIncomeBrl == null || monthlyIncomeBrl.signum() < 0
                || monthlyIncomeEur == null || monthlyIncomeEur.signum() < 0) {
            throw new IllegalArgumentException("Monthly incomes must be zero or positive");
        }
        this.id = id;
        this.name = name;
        this.baseCurrency = baseCurrency;
        this.monthlyIncomeBrl = monthlyIncomeBrl;
        this.monthlyIncomeEur = monthlyIncomeEur;
    }

    /**
     * Monthly income in the base currency. Only the income field matching
     * the base currency counts; the other one is informational.
     */
    public BigDecimal monthlyIncomeInBaseCurrency() {
        return baseCurrency == CurrencyCode.EUR ? monthlyIncomeEur : monthlyIncomeBrl;
    }
}

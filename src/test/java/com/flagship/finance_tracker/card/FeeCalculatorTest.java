package com.flagship.finance_tracker.card;

import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FeeCalculatorTest {

    private final FeeCalculator feeCalculator = new FeeCalculator();

    private static CreditCard card(Country country, CurrencyCode currency, String fxPercent, String taxPercent) {
        return new CreditCard(UUID.randomUUID(), country, currency, new BigDecimal(fxPercent),
            new BigDecimal(taxPercent), "Test Holder", "1234", true);
    }

    @Test
    @DisplayName("BRL card at 2.99%: no FX fee on BRL, 4.49 on EUR 150.00")
    void testFxFee_OnlyOnForeignCurrency() {
        CreditCard brlCard = card(Country.BRAZIL, CurrencyCode.BRL, "2.99", "0.00");
        BigDecimal amount = new BigDecimal("150.00");

        assertEquals(new BigDecimal("0.00"), feeCalculator.fxFee(amount, CurrencyCode.BRL, brlCard));
        assertEquals(new BigDecimal("4.49"), feeCalculator.fxFee(amount, CurrencyCode.EUR, brlCard));
    }

    @Test
    @DisplayName("Fees scale linearly with the amount")
    void testFxFee_ScalesLinearly() {
        CreditCard brlCard = card(Country.BRAZIL, CurrencyCode.BRL, "2.00", "0.00");

        BigDecimal single = feeCalculator.fxFee(new BigDecimal("100.00"), CurrencyCode.USD, brlCard);
        BigDecimal triple = feeCalculator.fxFee(new BigDecimal("300.00"), CurrencyCode.USD, brlCard);

        assertEquals(new BigDecimal("2.00"), single);
        assertEquals(0, single.multiply(BigDecimal.valueOf(3)).compareTo(triple));
    }

    @Test
    @DisplayName("Brazilian card pays tax abroad but not in BRL")
    void testTaxFee_BrazilianIssuer() {
        CreditCard brlCard = card(Country.BRAZIL, CurrencyCode.BRL, "0.00", "6.38");
        BigDecimal amount = new BigDecimal("100.00");

        assertEquals(new BigDecimal("0.00"), feeCalculator.taxFee(amount, CurrencyCode.BRL, brlCard));
        assertEquals(new BigDecimal("6.38"), feeCalculator.taxFee(amount, CurrencyCode.EUR, brlCard));
    }

    @Test
    @DisplayName("Portuguese card is never taxed, even with a non-zero tax percent")
    void testTaxFee_PortugueseIssuer() {
        CreditCard eurCard = card(Country.PORTUGAL, CurrencyCode.EUR, "1.50", "6.38");

        TransactionFees fees = feeCalculator.fees(new BigDecimal("200.00"), CurrencyCode.BRL, eurCard);

        assertEquals(new BigDecimal("3.00"), fees.getFxFee());
        assertEquals(new BigDecimal("0.00"), fees.getTaxFee());
    }

    @Test
    @DisplayName("FX and tax are computed on the amount, not compounded")
    void testFees_NotCompounded() {
        CreditCard brlCard = card(Country.BRAZIL, CurrencyCode.BRL, "4.00", "6.38");

        TransactionFees fees = feeCalculator.fees(new BigDecimal("50.00"), CurrencyCode.USD, brlCard);

        assertEquals(new BigDecimal("2.00"), fees.getFxFee());
        assertEquals(new BigDecimal("3.19"), fees.getTaxFee());
        assertEquals(new BigDecimal("5.19"), fees.getTotalFees());
        assertEquals(new BigDecimal("55.19"), fees.getTotalWithFees());
    }

    @Test
    @DisplayName("Each fee rounds half-up to cents")
    void testFees_RoundHalfUp() {
        CreditCard brlCard = card(Country.BRAZIL, CurrencyCode.BRL, "2.50", "0.00");

        // 10.10 * 2.5% = 0.2525
        assertEquals(new BigDecimal("0.25"), feeCalculator.fxFee(new BigDecimal("10.10"), CurrencyCode.EUR, brlCard));
        // 10.30 * 2.5% = 0.2575
        assertEquals(new BigDecimal("0.26"), feeCalculator.fxFee(new BigDecimal("10.30"), CurrencyCode.EUR, brlCard));
    }
}

package com.flagship.finance_tracker.payment;

import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Recurring obligation (rent, subscriptions, insurance).
 *
 * Monthly payments fall due every month of their start/end window; yearly
 * payments only in the month they started. The due day is the start
 * date's day of month, clamped to shorter months.
 */
@Value
public class FixedPayment {
    UUID id;
    String description;
    BigDecimal amount;
    CurrencyCode currency;
    Country country;
    PaymentFrequency frequency;
    LocalDate startDate;
    LocalDate endDate;
    boolean active;

    public FixedPayment(UUID id, String description, BigDecimal amount, CurrencyCode currency,
                        Country country, PaymentFrequency frequency, LocalDate startDate,
                        LocalDate endDate, boolean active) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        if (currency == null || country == null || frequency == null || startDate == null) {
            throw new IllegalArgumentException("Currency, country, frequency and start date are required");
        }
        if (endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException(
                "End date " + endDate + " is before start date " + startDate);
        }
        this.id = id;
        this.description = description;
        this.amount = amount;
        this.currency = currency;
        this.country = country;
        this.frequency = frequency;
        this.startDate = startDate;
        this.endDate = endDate;
        this.active = active;
    }

    public boolean isDueIn(YearMonth month) {
        if (!active) {
            return false;
        }
        if (month.isBefore(YearMonth.from(startDate))) {
            return false;
        }
        if (endDate != null && month.isAfter(YearMonth.from(endDate))) {
            return false;
        }
        return frequency == PaymentFrequency.MONTHLY || month.getMonth() == startDate.getMonth();
    }

    public LocalDate dueDateIn(YearMonth month) {
        return month.atDay(Math.min(startDate.getDayOfMonth(), month.lengthOfMonth()));
    }

    public FixedPayment deactivate() {
        return new FixedPayment(id, description, amount, currency, country, frequency,
            startDate, endDate, false);
    }
}

package com.flagship.finance_tracker.obligation;

import com.flagship.finance_tracker.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Ledger entry: one obligation for one month.
 *
 * Immutable. {@link #markPaid} and {@link #markPending} return new
 * instances; they are the only transitions. Overdue is never stored, it is
 * derived from the due date and the day asked about.
 */
@Value
public class ObligationStatus {
    UUID id;
    ObligationRef ref;
    YearMonth monthYear;
    LocalDate dueDate;
    BigDecimal expectedAmount;
    BigDecimal actualAmount;
    CurrencyCode currency;
    boolean paid;
    LocalDate paidDate;
    String notes;

    public static ObligationStatus schedule(UUID id, ObligationRef ref, YearMonth monthYear,
                                            LocalDate dueDate, BigDecimal expectedAmount,
                                            CurrencyCode currency, String notes) {
        if (ref == null) {
            throw new InvalidObligationReferenceException("Obligation reference is required");
        }
        if (monthYear == null || dueDate == null || currency == null) {
            throw new IllegalArgumentException("Month, due date and currency are required");
        }
        if (expectedAmount == null || expectedAmount.signum() < 0) {
            throw new IllegalArgumentException("Expected amount must be zero or positive");
        }
        return new ObligationStatus(id, ref, monthYear, dueDate, expectedAmount, null, currency,
            false, null, notes);
    }

    /**
     * @param actualAmount amount really paid; the expected amount when null
     * @param paidDate     day of payment; {@code today} when null
     */
    public ObligationStatus markPaid(BigDecimal actualAmount, LocalDate paidDate, LocalDate today) {
        if (actualAmount != null && actualAmount.signum() < 0) {
            throw new IllegalArgumentException("Actual amount must be zero or positive");
        }
        return new ObligationStatus(id, ref, monthYear, dueDate, expectedAmount,
            actualAmount != null ? actualAmount : expectedAmount,
            currency, true,
            paidDate != null ? paidDate : today,
            notes);
    }

    /**
     * Reverts to unpaid; the paid date and actual amount are cleared.
     */
    public ObligationStatus markPending() {
        return new ObligationStatus(id, ref, monthYear, dueDate, expectedAmount, null, currency,
            false, null, notes);
    }

    public boolean isOverdue(LocalDate today) {
        return !paid && dueDate.isBefore(today);
    }

    public ObligationState stateOn(LocalDate today) {
        if (paid) {
            return ObligationState.PAID;
        }
        return isOverdue(today) ? ObligationState.OVERDUE : ObligationState.PENDING;
    }

    /**
     * What the entry weighs in reports: the actual amount once paid,
     * otherwise the expected one.
     */
    public BigDecimal getEffectiveAmount() {
        return paid && actualAmount != null ? actualAmount : expectedAmount;
    }

    /**
     * Date whose exchange rate applies to this entry.
     */
    public LocalDate getRateDate() {
        return paid && paidDate != null ? paidDate : dueDate;
    }
}

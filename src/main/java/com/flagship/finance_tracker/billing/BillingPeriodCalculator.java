package com.flagship.finance_tracker.billing;

import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Calendar-month billing periods.
 *
 * The end of a period is always derived as "first day of the next month
 * minus one day", so 28/29/30/31-day months and leap years need no lookup
 * table. Pure: no state, no error conditions.
 */
@Component
public class BillingPeriodCalculator {

    /**
     * Period of the calendar month containing {@code anchorDate}.
     */
    public BillingPeriod period(LocalDate anchorDate) {
        LocalDate start = LocalDate.of(anchorDate.getYear(), anchorDate.getMonthValue(), 1);
        LocalDate firstOfNextMonth = start.getMonthValue() == 12
            ? LocalDate.of(start.getYear() + 1, 1, 1)
            : LocalDate.of(start.getYear(), start.getMonthValue() + 1, 1);
        return new BillingPeriod(start, firstOfNextMonth.minusDays(1));
    }

    /**
     * Successor period, anchored on the day after {@code current} ends.
     */
    public BillingPeriod next(BillingPeriod current) {
        return period(current.getEndDate().plusDays(1));
    }
}

package com.flagship.finance_tracker.billing;

import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Inclusive date range [startDate, endDate] covered by one card invoice.
 */
@Value
public class BillingPeriod {
    LocalDate startDate;
    LocalDate endDate;

    public BillingPeriod(LocalDate startDate, LocalDate endDate) {
        this.startDate = Objects.requireNonNull(startDate, "startDate");
        this.endDate = Objects.requireNonNull(endDate, "endDate");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException(
                String.format("Billing period end %s is before start %s", endDate, startDate));
        }
    }

    public long days() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    /**
     * True when {@code next} starts on the day after this period ends.
     */
    public boolean isFollowedBy(BillingPeriod next) {
        return endDate.plusDays(1).equals(next.getStartDate());
    }
}

package com.flagship.finance_tracker.exchange;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Which stored rate applies to a conversion on a given date.
 *
 * Each policy chooses between the closest rate on or before the target
 * date and the closest rate on or after it.
 */
public enum RateSelectionPolicy {

    /**
     * Latest rate dated on or before the target date.
     */
    MOST_RECENT_PRIOR {
        @Override
        public Optional<ExchangeRate> select(LocalDate target, Optional<ExchangeRate> prior,
                                             Optional<ExchangeRate> next) {
            return prior;
        }
    },

    /**
     * Only a rate dated exactly on the target date.
     */
    SAME_DAY_ONLY {
        @Override
        public Optional<ExchangeRate> select(LocalDate target, Optional<ExchangeRate> prior,
                                             Optional<ExchangeRate> next) {
            return prior.filter(rate -> rate.getRateDate().equals(target));
        }
    },

    /**
     * Closest rate in either direction; the earlier one wins a tie.
     */
    NEAREST {
        @Override
        public Optional<ExchangeRate> select(LocalDate target, Optional<ExchangeRate> prior,
                                             Optional<ExchangeRate> next) {
            if (prior.isEmpty()) {
                return next;
            }
            if (next.isEmpty()) {
                return prior;
            }
            long daysBefore = ChronoUnit.DAYS.between(prior.get().getRateDate(), target);
            long daysAfter = ChronoUnit.DAYS.between(target, next.get().getRateDate());
            return daysAfter < daysBefore ? next : prior;
        }
    };

    /**
     * @param prior closest rate dated on or before {@code target}
     * @param next  closest rate dated on or after {@code target}
     */
    public abstract Optional<ExchangeRate> select(LocalDate target, Optional<ExchangeRate> prior,
                                                  Optional<ExchangeRate> next);
}

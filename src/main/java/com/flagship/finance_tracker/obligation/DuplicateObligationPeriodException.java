package com.flagship.finance_tracker.obligation;

import com.flagship.finance_tracker.common.FinanceTrackerException;
import lombok.Getter;

import java.time.YearMonth;

@Getter
public class DuplicateObligationPeriodException extends FinanceTrackerException {

    private final ObligationRef ref;
    private final YearMonth monthYear;

    public DuplicateObligationPeriodException(ObligationRef ref, YearMonth monthYear) {
        super("Obligation " + ref + " already has a ledger entry for " + monthYear);
        this.ref = ref;
        this.monthYear = monthYear;
    }

    public DuplicateObligationPeriodException(ObligationRef ref, YearMonth monthYear, Throwable cause) {
        super("Obligation " + ref + " already has a ledger entry for " + monthYear, cause);
        this.ref = ref;
        this.monthYear = monthYear;
    }
}

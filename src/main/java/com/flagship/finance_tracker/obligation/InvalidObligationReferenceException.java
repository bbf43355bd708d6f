package com.flagship.finance_tracker.obligation;

import com.flagship.finance_tracker.common.FinanceTrackerException;

/**
 * A ledger entry must reference exactly one obligation.
 */
public class InvalidObligationReferenceException extends FinanceTrackerException {

    public InvalidObligationReferenceException(String message) {
        super(message);
    }
}

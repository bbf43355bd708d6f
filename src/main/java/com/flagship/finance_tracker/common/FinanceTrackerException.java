package com.flagship.finance_tracker.common;

/**
 * Base type of the typed failures raised by the billing and ledger core.
 * Callers translate them into responses; the core never retries them.
 */
public abstract class FinanceTrackerException extends RuntimeException {

    protected FinanceTrackerException(String message) {
        super(message);
    }

    protected FinanceTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.flagship.finance_tracker.invoice;

import com.flagship.finance_tracker.common.FinanceTrackerException;
import lombok.Getter;

import java.util.UUID;

/**
 * Raised when closing an invoice that is already closed.
 * No successor invoice is created when this is thrown.
 */
@Getter
public class AlreadyClosedException extends FinanceTrackerException {

    private final UUID invoiceId;

    public AlreadyClosedException(UUID invoiceId) {
        super("Invoice " + invoiceId + " is already closed");
        this.invoiceId = invoiceId;
    }
}

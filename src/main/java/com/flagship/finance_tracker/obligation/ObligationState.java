package com.flagship.finance_tracker.obligation;

/**
 * Read-time view of a ledger entry. Only PAID is stored (as is_paid);
 * PENDING and OVERDUE depend on the day the entry is looked at.
 */
public enum ObligationState {
    PENDING,
    PAID,
    OVERDUE
}

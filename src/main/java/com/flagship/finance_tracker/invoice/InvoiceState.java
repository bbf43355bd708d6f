package com.flagship.finance_tracker.invoice;

/**
 * Lifecycle of a single invoice instance.
 * A card's billing continues through a new OPEN instance once one is CLOSED.
 */
public enum InvoiceState {
    /**
     * Accepting charges for its billing period.
     * At most one invoice per card is in this state.
     */
    OPEN,

    /**
     * Terminal for this instance.
     */
    CLOSED
}

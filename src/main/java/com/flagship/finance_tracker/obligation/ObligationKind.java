package com.flagship.finance_tracker.obligation;

/**
 * The three sources a ledger entry can reference.
 */
public enum ObligationKind {
    FIXED,
    VARIABLE,
    CREDIT_CARD_INVOICE
}

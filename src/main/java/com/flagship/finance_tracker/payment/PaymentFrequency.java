package com.flagship.finance_tracker.payment;

/**
 * How often a fixed payment falls due.
 */
public enum PaymentFrequency {
    MONTHLY,
    YEARLY
}

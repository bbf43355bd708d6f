package com.flagship.finance_tracker.payment;

public enum ExpenseCategory {
    FOOD,
    TRANSPORT,
    ENTERTAINMENT,
    HEALTH,
    EDUCATION,
    SHOPPING,
    BILLS,
    OTHER
}

package com.flagship.finance_tracker.summary;

import com.flagship.finance_tracker.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;

/**
 * Financial picture of one month in a single base currency.
 *
 * Totals are in the base currency. The country and category breakdowns
 * split the expense total (also base currency); the currency breakdown
 * keeps the amounts as they were incurred and is not converted.
 */
@Value
@Builder
public class PeriodSummary {
    YearMonth monthYear;
    CurrencyCode baseCurrency;
    BigDecimal totalIncome;
    BigDecimal totalExpenses;
    BigDecimal totalFees;
    BigDecimal balance;
    Map<String, BigDecimal> expensesByCountry;
    Map<String, BigDecimal> expensesByCategory;
    Map<CurrencyCode, BigDecimal> expensesByOriginalCurrency;
    long entryCount;
    long paidCount;
    long pendingCount;
    long overdueCount;
}

package com.flagship.finance_tracker.summary.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.summary.PeriodSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;

@Value
@Builder
public class PeriodSummaryResponse {

    @JsonProperty("month_year")
    YearMonth monthYear;

    @JsonProperty("base_currency")
    CurrencyCode baseCurrency;

    @JsonProperty("total_income")
    BigDecimal totalIncome;

    @JsonProperty("total_expenses")
    BigDecimal totalExpenses;

    @JsonProperty("total_fees")
    BigDecimal totalFees;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("expenses_by_country")
    Map<String, BigDecimal> expensesByCountry;

    @JsonProperty("expenses_by_category")
    Map<String, BigDecimal> expensesByCategory;

    @JsonProperty("expenses_by_original_currency")
    Map<CurrencyCode, BigDecimal> expensesByOriginalCurrency;

    @JsonProperty("entry_count")
    long entryCount;

    @JsonProperty("paid_count")
    long paidCount;

    @JsonProperty("pending_count")
    long pendingCount;

    @JsonProperty("overdue_count")
    long overdueCount;

    public static PeriodSummaryResponse from(PeriodSummary summary) {
        return PeriodSummaryResponse.builder()
            .monthYear(summary.getMonthYear())
            .baseCurrency(summary.getBaseCurrency())
            .totalIncome(summary.getTotalIncome())
            .totalExpenses(summary.getTotalExpenses())
            .totalFees(summary.getTotalFees())
            .balance(summary.getBalance())
            .expensesByCountry(summary.getExpensesByCountry())
            .expensesByCategory(summary.getExpensesByCategory())
            .expensesByOriginalCurrency(summary.getExpensesByOriginalCurrency())
            .entryCount(summary.getEntryCount())
            .paidCount(summary.getPaidCount())
            .pendingCount(summary.getPendingCount())
            .overdueCount(summary.getOverdueCount())
            .build();
    }
}

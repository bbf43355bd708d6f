package com.flagship.finance_tracker.summary;

import com.flagship.finance_tracker.card.CreditCardService;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.exchange.ExchangeRateService;
import com.flagship.finance_tracker.exchange.MissingRateException;
import com.flagship.finance_tracker.invoice.InvoiceLifecycleService;
import com.flagship.finance_tracker.obligation.ObligationLedgerService;
import com.flagship.finance_tracker.obligation.ObligationRef;
import com.flagship.finance_tracker.obligation.ObligationState;
import com.flagship.finance_tracker.obligation.ObligationStatus;
import com.flagship.finance_tracker.observability.LedgerMetrics;
import com.flagship.finance_tracker.payment.FixedPaymentService;
import com.flagship.finance_tracker.payment.VariablePayment;
import com.flagship.finance_tracker.payment.VariablePaymentService;
import com.flagship.finance_tracker.profile.FinancialProfile;
import com.flagship.finance_tracker.profile.FinancialProfileService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only rollup of a month's ledger into one base currency.
 *
 * - Expense of an entry: actual amount when paid, expected otherwise,
 *   converted at the paid date when paid, at the due date otherwise.
 * - Fees: the stored FX and tax fees of variable payments, converted the
 *   same way as their entry.
 * - Income: the profile's income in its own base currency, converted at
 *   the first day of the month when the summary uses another base.
 *
 * Any conversion without a usable rate fails the whole summary with
 * {@link MissingRateException}; partial totals are never returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SummaryAggregator {

    static final String UNKNOWN = "UNKNOWN";
    static final String FIXED_CATEGORY = "FIXED";
    static final String CARD_CATEGORY = "CREDIT_CARD";

    private final ObligationLedgerService ledgerService;
    private final ExchangeRateService exchangeRateService;
    private final FinancialProfileService profileService;
    private final FixedPaymentService fixedPaymentService;
    private final VariablePaymentService variablePaymentService;
    private final InvoiceLifecycleService invoiceLifecycleService;
    private final CreditCardService creditCardService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * @throws MissingRateException if an amount cannot be converted into {@code baseCurrency}
     */
    @Transactional(readOnly = true)
    public PeriodSummary summarize(YearMonth monthYear, CurrencyCode baseCurrency) {
        long startTime = System.currentTimeMillis();
        LocalDate today = ledgerService.today();

        BigDecimal income = totalIncome(monthYear, baseCurrency);

        BigDecimal expenses = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        Map<String, BigDecimal> byCountry = new TreeMap<>();
        Map<String, BigDecimal> byCategory = new TreeMap<>();
        Map<CurrencyCode, BigDecimal> byCurrency = new EnumMap<>(CurrencyCode.class);
        long paid = 0;
        long pending = 0;
        long overdue = 0;

        List<ObligationStatus> entries = ledgerService.findByPeriod(monthYear);
        for (ObligationStatus entry : entries) {
            EntryDetails details = detailsOf(entry.getRef());

            BigDecimal converted = exchangeRateService.convert(
                entry.getEffectiveAmount(), entry.getCurrency(), baseCurrency, entry.getRateDate());
            expenses = expenses.add(converted);
            byCountry.merge(details.getCountry(), converted, BigDecimal::add);
            byCategory.merge(details.getCategory(), converted, BigDecimal::add);
            byCurrency.merge(entry.getCurrency(), entry.getEffectiveAmount(), BigDecimal::add);

            if (details.getFees().signum() > 0) {
                fees = fees.add(exchangeRateService.convert(
                    details.getFees(), details.getFeeCurrency(), baseCurrency, entry.getRateDate()));
            }

            ObligationState state = entry.stateOn(today);
            switch (state) {
                case PAID -> paid++;
                case PENDING -> pending++;
                case OVERDUE -> overdue++;
            }
        }

        PeriodSummary summary = PeriodSummary.builder()
            .monthYear(monthYear)
            .baseCurrency(baseCurrency)
            .totalIncome(income)
            .totalExpenses(expenses)
            .totalFees(fees)
            .balance(income.subtract(expenses).subtract(fees))
            .expensesByCountry(byCountry)
            .expensesByCategory(byCategory)
            .expensesByOriginalCurrency(byCurrency)
            .entryCount(entries.size())
            .paidCount(paid)
            .pendingCount(pending)
            .overdueCount(overdue)
            .build();

        long duration = System.currentTimeMillis() - startTime;
        ledgerMetrics.recordLatency("summarize", duration);
        log.debug("Summarized {} in {}: entries={}, balance={}, duration={}ms",
            monthYear, baseCurrency, entries.size(), summary.getBalance(), duration);
        return summary;
    }

    // Converted only when the requested base differs from the profile's
    private BigDecimal totalIncome(YearMonth monthYear, CurrencyCode baseCurrency) {
        FinancialProfile profile = profileService.current().orElse(null);
        if (profile == null) {
            log.debug("No financial profile, summarizing without income");
            return BigDecimal.ZERO;
        }
        return exchangeRateService.convert(profile.monthlyIncomeInBaseCurrency(),
            profile.getBaseCurrency(), baseCurrency, monthYear.atDay(1));
    }

    private EntryDetails detailsOf(ObligationRef ref) {
        return switch (ref.getKind()) {
            case FIXED -> fixedPaymentService.findById(ref.getId())
                .map(payment -> new EntryDetails(payment.getCountry().name(), FIXED_CATEGORY,
                    BigDecimal.ZERO, payment.getCurrency()))
                .orElseGet(() -> EntryDetails.unknown(FIXED_CATEGORY));
            case VARIABLE -> variablePaymentService.findById(ref.getId())
                .map(SummaryAggregator::detailsOfVariable)
                .orElseGet(() -> EntryDetails.unknown(UNKNOWN));
            case CREDIT_CARD_INVOICE -> invoiceLifecycleService.findById(ref.getId())
                .flatMap(invoice -> creditCardService.findById(invoice.getCreditCardId()))
                .map(card -> new EntryDetails(card.getIssuerCountry().name(), CARD_CATEGORY,
                    BigDecimal.ZERO, card.getCurrency()))
                .orElseGet(() -> EntryDetails.unknown(CARD_CATEGORY));
        };
    }

    private static EntryDetails detailsOfVariable(VariablePayment payment) {
        return new EntryDetails(payment.getCountry().name(), payment.getCategory().name(),
            payment.getTotalFees(), payment.getCurrency());
    }

    @Value
    private static class EntryDetails {
        String country;
        String category;
        BigDecimal fees;
        CurrencyCode feeCurrency;

        static EntryDetails unknown(String category) {
            return new EntryDetails(UNKNOWN, category, BigDecimal.ZERO, null);
        }
    }
}

package com.flagship.finance_tracker.exchange;

import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores exchange rates and converts amounts with them.
 *
 * Which stored rate applies to a date is decided by the configured
 * {@link RateSelectionPolicy} ({@code finance.exchange-rate.selection-policy}).
 * Converting a currency into itself uses 1 without a lookup.
 */
@Service
@Slf4j
public class ExchangeRateService {

    private static final int AMOUNT_SCALE = 2;

    private final ExchangeRateRepository repository;
    private final LedgerMetrics ledgerMetrics;
    private final RateSelectionPolicy selectionPolicy;

    public ExchangeRateService(
            ExchangeRateRepository repository,
            LedgerMetrics ledgerMetrics,
            @Value("${finance.exchange-rate.selection-policy:MOST_RECENT_PRIOR}") RateSelectionPolicy selectionPolicy) {
        this.repository = repository;
        this.ledgerMetrics = ledgerMetrics;
        this.selectionPolicy = selectionPolicy;
        log.info("Exchange rate selection policy: {}", selectionPolicy);
    }

    /**
     * @throws IllegalStateException if a rate for the pair and date already exists
     */
    @Transactional
    public ExchangeRate record(CurrencyCode fromCurrency, CurrencyCode toCurrency,
                               BigDecimal rate, LocalDate rateDate) {
        ExchangeRate exchangeRate = new ExchangeRate(UUID.randomUUID(), fromCurrency, toCurrency, rate, rateDate);
        if (repository.existsByFromCurrencyAndToCurrencyAndRateDate(fromCurrency, toCurrency, rateDate)) {
            throw new IllegalStateException(
                "Exchange rate " + fromCurrency + "->" + toCurrency + " already exists for " + rateDate);
        }
        ExchangeRate saved = repository.save(ExchangeRateEntity.fromDomain(exchangeRate)).toDomain();
        log.info("Recorded exchange rate: {}->{}={} on {}", fromCurrency, toCurrency, rate, rateDate);
        return saved;
    }

    /**
     * @throws MissingRateException if no stored rate satisfies the policy
     */
    @Transactional(readOnly = true)
    public BigDecimal rateFor(CurrencyCode fromCurrency, CurrencyCode toCurrency, LocalDate date) {
        if (fromCurrency == toCurrency) {
            return BigDecimal.ONE;
        }
        return findRate(fromCurrency, toCurrency, date)
            .map(ExchangeRate::getRate)
            .orElseThrow(() -> {
                ledgerMetrics.recordMissingRate(fromCurrency.name(), toCurrency.name());
                log.warn("Missing exchange rate: {}->{} for {} (policy={})",
                    fromCurrency, toCurrency, date, selectionPolicy);
                return new MissingRateException(fromCurrency, toCurrency, date);
            });
    }

    /**
     * Converts and rounds to cents, HALF_UP.
     *
     * @throws MissingRateException if no stored rate satisfies the policy
     */
    @Transactional(readOnly = true)
    public BigDecimal convert(BigDecimal amount, CurrencyCode fromCurrency, CurrencyCode toCurrency, LocalDate date) {
        return amount.multiply(rateFor(fromCurrency, toCurrency, date))
            .setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    @Transactional(readOnly = true)
    public Optional<ExchangeRate> findRate(CurrencyCode fromCurrency, CurrencyCode toCurrency, LocalDate date) {
        Optional<ExchangeRate> prior = repository
            .findFirstByFromCurrencyAndToCurrencyAndRateDateLessThanEqualOrderByRateDateDesc(fromCurrency, toCurrency, date)
            .map(ExchangeRateEntity::toDomain);
        Optional<ExchangeRate> next = selectionPolicy == RateSelectionPolicy.NEAREST
            ? repository
                .findFirstByFromCurrencyAndToCurrencyAndRateDateGreaterThanEqualOrderByRateDateAsc(fromCurrency, toCurrency, date)
                .map(ExchangeRateEntity::toDomain)
            : Optional.empty();
        return selectionPolicy.select(date, prior, next);
    }

    @Transactional(readOnly = true)
    public List<ExchangeRate> history(CurrencyCode fromCurrency, CurrencyCode toCurrency) {
        return repository.findByFromCurrencyAndToCurrencyOrderByRateDateDesc(fromCurrency, toCurrency).stream()
            .map(ExchangeRateEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ExchangeRate> findAll() {
        return repository.findAllByOrderByRateDateDesc().stream()
            .map(ExchangeRateEntity::toDomain)
            .toList();
    }

    public RateSelectionPolicy getSelectionPolicy() {
        return selectionPolicy;
    }
}

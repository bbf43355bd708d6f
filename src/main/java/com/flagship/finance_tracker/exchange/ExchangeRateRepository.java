package com.flagship.finance_tracker.exchange;

import com.flagship.finance_tracker.common.CurrencyCode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExchangeRateRepository extends JpaRepository<ExchangeRateEntity, UUID> {

    boolean existsByFromCurrencyAndToCurrencyAndRateDate(
        CurrencyCode fromCurrency, CurrencyCode toCurrency, LocalDate rateDate);

    Optional<ExchangeRateEntity> findFirstByFromCurrencyAndToCurrencyAndRateDateLessThanEqualOrderByRateDateDesc(
        CurrencyCode fromCurrency, CurrencyCode toCurrency, LocalDate rateDate);

    Optional<ExchangeRateEntity> findFirstByFromCurrencyAndToCurrencyAndRateDateGreaterThanEqualOrderByRateDateAsc(
        CurrencyCode fromCurrency, CurrencyCode toCurrency, LocalDate rateDate);

    List<ExchangeRateEntity> findByFromCurrencyAndToCurrencyOrderByRateDateDesc(
        CurrencyCode fromCurrency, CurrencyCode toCurrency);

    List<ExchangeRateEntity> findAllByOrderByRateDateDesc();
}

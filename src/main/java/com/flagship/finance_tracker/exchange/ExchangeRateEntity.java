package com.flagship.finance_tracker.exchange;

import com.flagship.finance_tracker.common.CurrencyCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "exchange_rates",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_exchange_rates_pair_date",
        columnNames = {"from_currency", "to_currency", "rate_date"}
    )
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExchangeRateEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_currency", nullable = false, updatable = false, length = 3)
    private CurrencyCode fromCurrency;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_currency", nullable = false, updatable = false, length = 3)
    private CurrencyCode toCurrency;

    @Column(nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal rate;

    @Column(name = "rate_date", nullable = false, updatable = false)
    private LocalDate rateDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static ExchangeRateEntity fromDomain(ExchangeRate rate) {
        return new ExchangeRateEntity(
            rate.getId(),
            rate.getFromCurrency(),
            rate.getToCurrency(),
            rate.getRate(),
            rate.getRateDate(),
            null
        );
    }

    public ExchangeRate toDomain() {
        return new ExchangeRate(id, fromCurrency, toCurrency, rate, rateDate);
    }
}

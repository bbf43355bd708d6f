package com.flagship.finance_tracker.profile;

import com.flagship.finance_tracker.common.CurrencyCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "financial_profiles")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FinancialProfileEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "base_currency", nullable = false, length = 3)
    private CurrencyCode baseCurrency;

    @Column(name = "monthly_income_brl", nullable = false, precision = 19, scale = 2)
    private BigDecimal monthlyIncomeBrl;

    @Column(name = "monthly_income_eur", nullable = false, precision = 19, scale = 2)
    private BigDecimal monthlyIncomeEur;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static FinancialProfileEntity fromDomain(FinancialProfile profile) {
        return new FinancialProfileEntity(
            profile.getId(),
            profile.getName(),
            profile.getBaseCurrency(),
            profile.getMonthlyIncomeBrl(),
            profile.getMonthlyIncomeEur(),
            null,
            null
        );
    }

    public FinancialProfile toDomain() {
        return new FinancialProfile(id, name, baseCurrency, monthlyIncomeBrl, monthlyIncomeEur);
    }

    void updateFromDomain(FinancialProfile profile) {
        this.name = profile.getName();
        this.baseCurrency = profile.getBaseCurrency();
        this.monthlyIncomeBrl = profile.getMonthlyIncomeBrl();
        this.monthlyIncomeEur = profile.getMonthlyIncomeEur();
    }
}

package com.flagship.finance_tracker.payment;

import com.flagship.finance_tracker.common.Country;
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
@Table(name = "fixed_payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FixedPaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String description;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Country country;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private PaymentFrequency frequency;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "is_active", nullable = false)
    private boolean active;

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

    static FixedPaymentEntity fromDomain(FixedPayment payment) {
        return new FixedPaymentEntity(
            payment.getId(),
            payment.getDescription(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getCountry(),
            payment.getFrequency(),
            payment.getStartDate(),
            payment.getEndDate(),
            payment.isActive(),
            null,
            null
        );
    }

    public FixedPayment toDomain() {
        return new FixedPayment(id, description, amount, currency, country, frequency,
            startDate, endDate, active);
    }

    void updateFromDomain(FixedPayment payment) {
        this.active = payment.isActive();
    }
}

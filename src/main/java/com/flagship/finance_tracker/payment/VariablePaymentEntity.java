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

/**
 * Variable payments are immutable once recorded, so every column is
 * non-updatable.
 */
@Entity
@Table(
    name = "variable_payments",
    indexes = @Index(name = "idx_variable_payments_date", columnList = "payment_date")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VariablePaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payment_date", nullable = false, updatable = false)
    private LocalDate date;

    @Column(nullable = false, updatable = false, length = 200)
    private String description;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private Country country;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private ExpenseCategory category;

    @Column(name = "credit_card_id", updatable = false)
    private UUID creditCardId;

    @Column(name = "fx_fee_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal fxFeeAmount;

    @Column(name = "tax_fee_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal taxFeeAmount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static VariablePaymentEntity fromDomain(VariablePayment payment) {
        return new VariablePaymentEntity(
            payment.getId(),
            payment.getDate(),
            payment.getDescription(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getCountry(),
            payment.getCategory(),
            payment.getCreditCardId(),
            payment.getFxFeeAmount(),
            payment.getTaxFeeAmount(),
            null
        );
    }

    public VariablePayment toDomain() {
        return new VariablePayment(id, date, description, amount, currency, country, category,
            creditCardId, fxFeeAmount, taxFeeAmount);
    }
}

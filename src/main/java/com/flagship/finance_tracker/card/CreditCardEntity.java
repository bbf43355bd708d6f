package com.flagship.finance_tracker.card;

import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for credit cards.
 *
 * No setters: the only mutation is activation/deactivation through
 * {@link #deactivate()}.
 */
@Entity
@Table(name = "credit_cards")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CreditCardEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "issuer_country", nullable = false, length = 20)
    private Country issuerCountry;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "fx_fee_percent", nullable = false, precision = 5, scale = 2)
    private BigDecimal fxFeePercent;

    @Column(name = "tax_percent", nullable = false, precision = 5, scale = 2)
    private BigDecimal taxPercent;

    @Column(name = "cardholder_name", nullable = false, length = 100)
    private String cardholderName;

    @Column(name = "final_digits", nullable = false, length = 4)
    private String finalDigits;

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

    static CreditCardEntity fromDomain(CreditCard card) {
        return new CreditCardEntity(
            card.getId(),
            card.getIssuerCountry(),
            card.getCurrency(),
            card.getFxFeePercent(),
            card.getTaxPercent(),
            card.getCardholderName(),
            card.getFinalDigits(),
            card.isActive(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public CreditCard toDomain() {
        return new CreditCard(
            id,
            issuerCountry,
            currency,
            fxFeePercent,
            taxPercent,
            cardholderName,
            finalDigits,
            active
        );
    }

    void deactivate() {
        this.active = false;
    }
}

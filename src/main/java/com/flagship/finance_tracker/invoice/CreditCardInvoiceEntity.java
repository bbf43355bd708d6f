package com.flagship.finance_tracker.invoice;

import com.flagship.finance_tracker.billing.BillingPeriod;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for credit card invoices.
 *
 * Card and period are fixed at creation (updatable = false). The close
 * transition is the only update and goes through {@link #updateFromDomain}.
 * The (credit_card_id, start_date) unique constraint rejects a second
 * successor for the same period.
 */
@Entity
@Table(
    name = "credit_card_invoices",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_invoices_card_start",
        columnNames = {"credit_card_id", "start_date"}
    ),
    indexes = @Index(name = "idx_invoices_card_closed", columnList = "credit_card_id, is_closed")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CreditCardInvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "credit_card_id", nullable = false, updatable = false)
    private UUID creditCardId;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false, updatable = false)
    private LocalDate endDate;

    @Column(name = "is_closed", nullable = false)
    private boolean closed;

    @Column(name = "closed_at")
    private Instant closedAt;

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

    static CreditCardInvoiceEntity fromDomain(CreditCardInvoice invoice) {
        return new CreditCardInvoiceEntity(
            invoice.getId(),
            invoice.getCreditCardId(),
            invoice.getPeriod().getStartDate(),
            invoice.getPeriod().getEndDate(),
            invoice.isClosed(),
            invoice.getClosedAt(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public CreditCardInvoice toDomain() {
        return new CreditCardInvoice(
            id,
            creditCardId,
            new BillingPeriod(startDate, endDate),
            closed,
            closedAt
        );
    }

    /**
     * Copies the close transition. An entity can be closed once; reopening
     * is not a state the domain can produce.
     */
    void updateFromDomain(CreditCardInvoice invoice) {
        if (this.closed && !invoice.isClosed()) {
            throw new IllegalStateException("Invoice " + id + " cannot be reopened");
        }
        this.closed = invoice.isClosed();
        this.closedAt = invoice.getClosedAt();
    }
}

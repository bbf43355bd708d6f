package com.flagship.finance_tracker.obligation;

import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.common.YearMonthAttributeConverter;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * JPA entity for ledger entries.
 *
 * The reference is stored as (obligation_kind, obligation_id); the unique
 * constraint on (obligation_kind, obligation_id, month_year) makes a second
 * entry for the same obligation and month impossible even between
 * concurrent writers. The reference and period never change after insert.
 */
@Entity
@Table(
    name = "obligation_statuses",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_obligation_period",
        columnNames = {"obligation_kind", "obligation_id", "month_year"}
    ),
    indexes = {
        @Index(name = "idx_obligations_month", columnList = "month_year"),
        @Index(name = "idx_obligations_due", columnList = "due_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ObligationStatusEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "obligation_kind", nullable = false, updatable = false, length = 30)
    private ObligationKind obligationKind;

    @Column(name = "obligation_id", nullable = false, updatable = false)
    private UUID obligationId;

    @Convert(converter = YearMonthAttributeConverter.class)
    @Column(name = "month_year", nullable = false, updatable = false)
    private YearMonth monthYear;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Column(name = "expected_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal expectedAmount;

    @Column(name = "actual_amount", precision = 19, scale = 2)
    private BigDecimal actualAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "is_paid", nullable = false)
    private boolean paid;

    @Column(name = "paid_date")
    private LocalDate paidDate;

    @Column(columnDefinition = "TEXT")
    private String notes;

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

    static ObligationStatusEntity fromDomain(ObligationStatus status) {
        return new ObligationStatusEntity(
            status.getId(),
            status.getRef().getKind(),
            status.getRef().getId(),
            status.getMonthYear(),
            status.getDueDate(),
            status.getExpectedAmount(),
            status.getActualAmount(),
            status.getCurrency(),
            status.isPaid(),
            status.getPaidDate(),
            status.getNotes(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public ObligationStatus toDomain() {
        return new ObligationStatus(
            id,
            new ObligationRef(obligationKind, obligationId),
            monthYear,
            dueDate,
            expectedAmount,
            actualAmount,
            currency,
            paid,
            paidDate,
            notes
        );
    }

    /**
     * Copies the settlement fields, the only ones a transition changes.
     */
    void updateFromDomain(ObligationStatus status) {
        this.paid = status.isPaid();
        this.paidDate = status.getPaidDate();
        this.actualAmount = status.getActualAmount();
    }
}

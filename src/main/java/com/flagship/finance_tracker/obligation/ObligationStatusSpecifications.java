package com.flagship.finance_tracker.obligation;

import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Criteria building blocks for {@link ObligationStatusFilter}.
 */
final class ObligationStatusSpecifications {

    private ObligationStatusSpecifications() {
    }

    static Specification<ObligationStatusEntity> matching(ObligationStatusFilter filter, LocalDate today) {
        Specification<ObligationStatusEntity> spec = Specification.where(null);
        if (filter.getKind() != null) {
            spec = spec.and(hasKind(filter.getKind()));
        }
        if (filter.getPeriod() != null) {
            spec = spec.and(inPeriod(filter.getPeriod()));
        }
        if (filter.getInvoiceId() != null) {
            spec = spec.and(linkedToInvoice(filter.getInvoiceId()));
        }
        if (filter.getState() != null) {
            spec = spec.and(inState(filter.getState(), today));
        }
        return spec;
    }

    static Specification<ObligationStatusEntity> hasKind(ObligationKind kind) {
        return (root, query, cb) -> cb.equal(root.get("obligationKind"), kind);
    }

    static Specification<ObligationStatusEntity> inPeriod(YearMonth period) {
        return (root, query, cb) -> cb.equal(root.get("monthYear"), period);
    }

    static Specification<ObligationStatusEntity> linkedToInvoice(UUID invoiceId) {
        return (root, query, cb) -> cb.and(
            cb.equal(root.get("obligationKind"), ObligationKind.CREDIT_CARD_INVOICE),
            cb.equal(root.get("obligationId"), invoiceId)
        );
    }

    /**
     * Same rule as {@link ObligationStatus#stateOn(LocalDate)}, expressed
     * in SQL so the database does the filtering.
     */
    static Specification<ObligationStatusEntity> inState(ObligationState state, LocalDate today) {
        return switch (state) {
            case PAID -> (root, query, cb) -> cb.isTrue(root.<Boolean>get("paid"));
            case OVERDUE -> (root, query, cb) -> cb.and(
                cb.isFalse(root.<Boolean>get("paid")),
                cb.lessThan(root.<LocalDate>get("dueDate"), today)
            );
            case PENDING -> (root, query, cb) -> cb.and(
                cb.isFalse(root.<Boolean>get("paid")),
                cb.greaterThanOrEqualTo(root.<LocalDate>get("dueDate"), today)
            );
        };
    }
}

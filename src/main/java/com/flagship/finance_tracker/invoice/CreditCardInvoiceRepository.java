package com.flagship.finance_tracker.invoice;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CreditCardInvoiceRepository extends JpaRepository<CreditCardInvoiceEntity, UUID> {

    /**
     * Loads an invoice with a row lock (SELECT ... FOR UPDATE) held until the
     * surrounding transaction ends. Concurrent closes of the same invoice
     * queue here and the later one observes is_closed = true.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM CreditCardInvoiceEntity i WHERE i.id = :id")
    Optional<CreditCardInvoiceEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<CreditCardInvoiceEntity> findFirstByCreditCardIdAndClosedFalse(UUID creditCardId);

    List<CreditCardInvoiceEntity> findByCreditCardIdAndClosedTrueOrderByStartDateDesc(UUID creditCardId);

    List<CreditCardInvoiceEntity> findByCreditCardIdOrderByStartDateAsc(UUID creditCardId);

    boolean existsByCreditCardId(UUID creditCardId);
}

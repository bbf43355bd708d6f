package com.flagship.finance_tracker.card;

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
public interface CreditCardRepository extends JpaRepository<CreditCardEntity, UUID> {

    List<CreditCardEntity> findByActiveTrueOrderByCardholderNameAsc();

    /**
     * Row lock on the card, taken while bootstrapping its first invoice so
     * two concurrent bootstraps cannot both see "no invoices yet".
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CreditCardEntity c WHERE c.id = :id")
    Optional<CreditCardEntity> findByIdForUpdate(@Param("id") UUID id);
}

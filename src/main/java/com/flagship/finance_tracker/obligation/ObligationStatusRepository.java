package com.flagship.finance_tracker.obligation;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ObligationStatusRepository extends JpaRepository<ObligationStatusEntity, UUID>,
        JpaSpecificationExecutor<ObligationStatusEntity> {

    boolean existsByObligationKindAndObligationIdAndMonthYear(
        ObligationKind obligationKind, UUID obligationId, YearMonth monthYear);

    List<ObligationStatusEntity> findByObligationKindAndObligationIdOrderByMonthYearAsc(
        ObligationKind obligationKind, UUID obligationId);

    List<ObligationStatusEntity> findByMonthYearOrderByDueDateAscObligationKindAsc(YearMonth monthYear);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM ObligationStatusEntity o WHERE o.id = :id")
    Optional<ObligationStatusEntity> findByIdForUpdate(@Param("id") UUID id);
}

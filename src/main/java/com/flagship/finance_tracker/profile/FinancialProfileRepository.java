package com.flagship.finance_tracker.profile;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface FinancialProfileRepository extends JpaRepository<FinancialProfileEntity, UUID> {

    Optional<FinancialProfileEntity> findFirstByOrderByCreatedAtAsc();
}

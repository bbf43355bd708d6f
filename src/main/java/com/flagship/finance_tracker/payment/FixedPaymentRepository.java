package com.flagship.finance_tracker.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FixedPaymentRepository extends JpaRepository<FixedPaymentEntity, UUID> {

    List<FixedPaymentEntity> findByActiveTrueOrderByStartDateAsc();
}

package com.flagship.finance_tracker.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface VariablePaymentRepository extends JpaRepository<VariablePaymentEntity, UUID> {

    List<VariablePaymentEntity> findByDateBetweenOrderByDateAsc(LocalDate from, LocalDate to);

    List<VariablePaymentEntity> findByCreditCardIdOrderByDateAsc(UUID creditCardId);
}

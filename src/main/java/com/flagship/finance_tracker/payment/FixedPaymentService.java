package com.flagship.finance_tracker.payment;

import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.common.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class FixedPaymentService {

    private final FixedPaymentRepository repository;

    @Transactional
    public FixedPayment create(String description, BigDecimal amount, CurrencyCode currency,
                               Country country, PaymentFrequency frequency,
                               LocalDate startDate, LocalDate endDate) {
        FixedPayment payment = new FixedPayment(UUID.randomUUID(), description, amount, currency,
            country, frequency, startDate, endDate, true);
        FixedPaymentEntity saved = repository.save(FixedPaymentEntity.fromDomain(payment));
        log.info("Created fixed payment: id={}, amount={} {}, frequency={}",
            saved.getId(), amount, currency, frequency);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<FixedPayment> findById(UUID id) {
        return repository.findById(id).map(FixedPaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public FixedPayment getById(UUID id) {
        return findById(id).orElseThrow(() -> new ResourceNotFoundException("Fixed payment", id));
    }

    @Transactional(readOnly = true)
    public boolean exists(UUID id) {
        return repository.existsById(id);
    }

    @Transactional(readOnly = true)
    public List<FixedPayment> findActive() {
        return repository.findByActiveTrueOrderByStartDateAsc().stream()
            .map(FixedPaymentEntity::toDomain)
            .toList();
    }

    /**
     * Active fixed payments that fall due in the given month.
     */
    @Transactional(readOnly = true)
    public List<FixedPayment> findDueIn(YearMonth month) {
        return findActive().stream()
            .filter(payment -> payment.isDueIn(month))
            .toList();
    }

    @Transactional
    public FixedPayment deactivate(UUID id) {
        FixedPaymentEntity entity = repository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Fixed payment", id));
        entity.updateFromDomain(entity.toDomain().deactivate());
        log.info("Deactivated fixed payment: id={}", id);
        return repository.save(entity).toDomain();
    }
}

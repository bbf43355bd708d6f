package com.flagship.finance_tracker.profile;

import com.flagship.finance_tracker.common.CurrencyCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * The tracker has a single profile; saving creates it the first time and
 * updates it afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinancialProfileService {

    private final FinancialProfileRepository repository;

    @Transactional(readOnly = true)
    public Optional<FinancialProfile> current() {
        return repository.findFirstByOrderByCreatedAtAsc().map(FinancialProfileEntity::toDomain);
    }

    @Transactional
    public FinancialProfile save(String name, CurrencyCode baseCurrency,
                                 BigDecimal monthlyIncomeBrl, BigDecimal monthlyIncomeEur) {
        Optional<FinancialProfileEntity> existing = repository.findFirstByOrderByCreatedAtAsc();
        UUID id = existing.map(FinancialProfileEntity::getId).orElseGet(UUID::randomUUID);
        FinancialProfile profile = new FinancialProfile(id, name, baseCurrency,
            monthlyIncomeBrl != null ? monthlyIncomeBrl : BigDecimal.ZERO,
            monthlyIncomeEur != null ? monthlyIncomeEur : BigDecimal.ZERO);

        FinancialProfileEntity entity = existing.orElse(null);
        if (entity == null) {
            entity = FinancialProfileEntity.fromDomain(profile);
            log.info("Created financial profile: baseCurrency={}", baseCurrency);
        } else {
            entity.updateFromDomain(profile);
            log.info("Updated financial profile: baseCurrency={}", baseCurrency);
        }
        return repository.save(entity).toDomain();
    }
}

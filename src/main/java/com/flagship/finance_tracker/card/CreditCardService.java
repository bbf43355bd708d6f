package com.flagship.finance_tracker.card;

import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.common.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registration and lookup of credit cards.
 *
 * Cards are owned outside the billing core; this service exists so the
 * core has something to read fees and currencies from.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditCardService {

    private final CreditCardRepository repository;

    @Transactional
    public CreditCard register(Country issuerCountry, CurrencyCode currency,
                               BigDecimal fxFeePercent, BigDecimal taxPercent,
                               String cardholderName, String finalDigits) {
        if (issuerCountry == null || currency == null) {
            throw new IllegalArgumentException("Issuer country and currency are required");
        }
        requireNonNegative(fxFeePercent, "FX fee percent");
        requireNonNegative(taxPercent, "Tax percent");
        if (finalDigits == null || !finalDigits.matches("\\d{4}")) {
            throw new IllegalArgumentException("Final digits must be exactly 4 digits");
        }

        CreditCard card = new CreditCard(UUID.randomUUID(), issuerCountry, currency,
            fxFeePercent, taxPercent, cardholderName, finalDigits, true);
        CreditCardEntity saved = repository.save(CreditCardEntity.fromDomain(card));
        log.info("Registered credit card: cardId={}, issuer={}, currency={}",
            saved.getId(), issuerCountry, currency);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<CreditCard> findById(UUID cardId) {
        return repository.findById(cardId).map(CreditCardEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public CreditCard getById(UUID cardId) {
        return findById(cardId)
            .orElseThrow(() -> new ResourceNotFoundException("Credit card", cardId));
    }

    /**
     * Loads the card with a row lock held by the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CreditCard lockForUpdate(UUID cardId) {
        return repository.findByIdForUpdate(cardId)
            .map(CreditCardEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Credit card", cardId));
    }

    @Transactional(readOnly = true)
    public List<CreditCard> findActive() {
        return repository.findByActiveTrueOrderByCardholderNameAsc().stream()
            .map(CreditCardEntity::toDomain)
            .toList();
    }

    @Transactional
    public CreditCard deactivate(UUID cardId) {
        CreditCardEntity entity = repository.findById(cardId)
            .orElseThrow(() -> new ResourceNotFoundException("Credit card", cardId));
        entity.deactivate();
        log.info("Deactivated credit card: cardId={}", cardId);
        return repository.save(entity).toDomain();
    }

    private static void requireNonNegative(BigDecimal value, String label) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException(label + " must be zero or positive");
        }
    }
}

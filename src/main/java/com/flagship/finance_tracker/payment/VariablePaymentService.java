package com.flagship.finance_tracker.payment;

import com.flagship.finance_tracker.card.CreditCard;
import com.flagship.finance_tracker.card.CreditCardService;
import com.flagship.finance_tracker.card.FeeCalculator;
import com.flagship.finance_tracker.card.TransactionFees;
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

/**
 * Records one-off expenses. Card payments get their FX and tax fees from
 * {@link FeeCalculator} at record time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VariablePaymentService {

    private final VariablePaymentRepository repository;
    private final CreditCardService creditCardService;
    private final FeeCalculator feeCalculator;

    @Transactional
    public VariablePayment record(LocalDate date, String description, BigDecimal amount,
                                  CurrencyCode currency, Country country, ExpenseCategory category,
                                  UUID creditCardId) {
        if (date == null || currency == null || country == null || category == null) {
            throw new IllegalArgumentException("Date, currency, country and category are required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }

        TransactionFees fees = TransactionFees.none(amount);
        if (creditCardId != null) {
            CreditCard card = creditCardService.getById(creditCardId);
            if (!card.isActive()) {
                throw new IllegalStateException("Credit card " + creditCardId + " is not active");
            }
            fees = feeCalculator.fees(amount, currency, card);
        }

        VariablePayment payment = new VariablePayment(UUID.randomUUID(), date, description, amount,
            currency, country, category, creditCardId, fees.getFxFee(), fees.getTaxFee());
        VariablePaymentEntity saved = repository.save(VariablePaymentEntity.fromDomain(payment));

        log.info("Recorded variable payment: id={}, amount={} {}, fxFee={}, taxFee={}",
            saved.getId(), amount, currency, fees.getFxFee(), fees.getTaxFee());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<VariablePayment> findById(UUID id) {
        return repository.findById(id).map(VariablePaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public VariablePayment getById(UUID id) {
        return findById(id).orElseThrow(() -> new ResourceNotFoundException("Variable payment", id));
    }

    @Transactional(readOnly = true)
    public boolean exists(UUID id) {
        return repository.existsById(id);
    }

    @Transactional(readOnly = true)
    public List<VariablePayment> findIn(YearMonth month) {
        return repository.findByDateBetweenOrderByDateAsc(month.atDay(1), month.atEndOfMonth()).stream()
            .map(VariablePaymentEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<VariablePayment> findByCard(UUID creditCardId) {
        return repository.findByCreditCardIdOrderByDateAsc(creditCardId).stream()
            .map(VariablePaymentEntity::toDomain)
            .toList();
    }
}

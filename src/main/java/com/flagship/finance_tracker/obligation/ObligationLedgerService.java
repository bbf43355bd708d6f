package com.flagship.finance_tracker.obligation;

import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.common.ResourceNotFoundException;
import com.flagship.finance_tracker.invoice.InvoiceLifecycleService;
import com.flagship.finance_tracker.obligation.event.ObligationPaidEvent;
import com.flagship.finance_tracker.obligation.event.ObligationReopenedEvent;
import com.flagship.finance_tracker.obligation.event.ObligationScheduledEvent;
import com.flagship.finance_tracker.observability.CorrelationContext;
import com.flagship.finance_tracker.observability.LedgerMetrics;
import com.flagship.finance_tracker.outbox.AggregateType;
import com.flagship.finance_tracker.outbox.OutboxService;
import com.flagship.finance_tracker.payment.FixedPayment;
import com.flagship.finance_tracker.payment.FixedPaymentService;
import com.flagship.finance_tracker.payment.VariablePaymentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The reconciliation ledger: one entry per obligation per month.
 *
 * Invariants kept here:
 * 1. Every entry references exactly one existing obligation.
 * 2. (reference, month) is unique. The pre-check gives a clean error for
 *    the common case; the unique constraint settles concurrent writers.
 * 3. Only markPaid and markPending change an entry after it is scheduled,
 *    and both hold the entry's row lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ObligationLedgerService {

    private static final Sort LEDGER_ORDER = Sort.by("dueDate").and(Sort.by("obligationKind"));

    private final ObligationStatusRepository repository;
    private final FixedPaymentService fixedPaymentService;
    private final VariablePaymentService variablePaymentService;
    private final InvoiceLifecycleService invoiceLifecycleService;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    /**
     * Creates the ledger entry of {@code ref} for {@code monthYear}.
     *
     * @throws ResourceNotFoundException           if the referenced obligation does not exist
     * @throws DuplicateObligationPeriodException if the obligation already has an entry for the month
     * @throws IllegalArgumentException           if an invoice entry is not in its card's currency
     */
    @Transactional
    public ObligationStatus schedule(ObligationRef ref, YearMonth monthYear, LocalDate dueDate,
                                     BigDecimal expectedAmount, CurrencyCode currency, String notes) {
        long startTime = System.currentTimeMillis();
        try {
            requireObligationExists(ref);
            requireInvoiceCurrency(ref, currency);
            ObligationStatus saved = insert(ObligationStatus.schedule(
                UUID.randomUUID(), ref, monthYear, dueDate, expectedAmount, currency, notes));

            ledgerMetrics.recordObligationScheduled(ref.getKind().name(), "success");
            ledgerMetrics.recordLatency("schedule_obligation", System.currentTimeMillis() - startTime);
            return saved;

        } catch (DuplicateObligationPeriodException e) {
            ledgerMetrics.recordObligationScheduled(ref.getKind().name(), "duplicate");
            log.warn("Rejected duplicate ledger entry: ref={}, month={}", ref, monthYear);
            throw e;
        }
    }

    /**
     * Schedules every active fixed payment due in {@code monthYear} that has
     * no entry for it yet. Entries that already exist are left alone.
     *
     * @return the entries created by this call
     */
    @Transactional
    public List<ObligationStatus> scheduleFixedPayments(YearMonth monthYear) {
        List<ObligationStatus> created = new ArrayList<>();
        for (FixedPayment payment : fixedPaymentService.findDueIn(monthYear)) {
            ObligationRef ref = ObligationRef.fixed(payment.getId());
            if (repository.existsByObligationKindAndObligationIdAndMonthYear(
                    ref.getKind(), ref.getId(), monthYear)) {
                log.debug("Fixed payment already scheduled: ref={}, month={}", ref, monthYear);
                continue;
            }
            created.add(insert(ObligationStatus.schedule(UUID.randomUUID(), ref, monthYear,
                payment.dueDateIn(monthYear), payment.getAmount(), payment.getCurrency(), null)));
            ledgerMetrics.recordObligationScheduled(ref.getKind().name(), "success");
        }
        log.info("Scheduled fixed payments: month={}, created={}", monthYear, created.size());
        return created;
    }

    /**
     * @param actualAmount defaults to the expected amount
     * @param paidDate     defaults to today
     */
    @Transactional
    public ObligationStatus markPaid(UUID statusId, BigDecimal actualAmount, LocalDate paidDate) {
        MDC.put(CorrelationContext.OBLIGATION_ID_MDC_KEY, statusId.toString());
        try {
            ObligationStatusEntity entity = lockEntry(statusId);
            ObligationStatus paid = entity.toDomain().markPaid(actualAmount, paidDate, LocalDate.now(clock));
            entity.updateFromDomain(paid);
            repository.save(entity);

            outboxService.saveEvent(AggregateType.OBLIGATION_STATUS, statusId,
                ObligationPaidEvent.EVENT_TYPE, ObligationPaidEvent.fromStatus(paid));
            ledgerMetrics.recordObligationSettled(paid.getRef().getKind().name(), "paid");

            log.info("Ledger entry paid: actualAmount={} {}, paidDate={}",
                paid.getActualAmount(), paid.getCurrency(), paid.getPaidDate());
            return paid;
        } finally {
            MDC.remove(CorrelationContext.OBLIGATION_ID_MDC_KEY);
        }
    }

    @Transactional
    public ObligationStatus markPending(UUID statusId) {
        MDC.put(CorrelationContext.OBLIGATION_ID_MDC_KEY, statusId.toString());
        try {
            ObligationStatusEntity entity = lockEntry(statusId);
            ObligationStatus pending = entity.toDomain().markPending();
            entity.updateFromDomain(pending);
            repository.save(entity);

            outboxService.saveEvent(AggregateType.OBLIGATION_STATUS, statusId,
                ObligationReopenedEvent.EVENT_TYPE, ObligationReopenedEvent.fromStatus(pending));
            ledgerMetrics.recordObligationSettled(pending.getRef().getKind().name(), "reopened");

            log.info("Ledger entry reverted to pending");
            return pending;
        } finally {
            MDC.remove(CorrelationContext.OBLIGATION_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Optional<ObligationStatus> findById(UUID statusId) {
        return repository.findById(statusId).map(ObligationStatusEntity::toDomain);
    }

    /**
     * Entries matching all non-null criteria of the filter, ordered by due
     * date then kind. State criteria are evaluated against today.
     */
    @Transactional(readOnly = true)
    public List<ObligationStatus> find(ObligationStatusFilter filter) {
        return repository.findAll(ObligationStatusSpecifications.matching(filter, today()), LEDGER_ORDER).stream()
            .map(ObligationStatusEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ObligationStatus> findByPeriod(YearMonth monthYear) {
        return repository.findByMonthYearOrderByDueDateAscObligationKindAsc(monthYear).stream()
            .map(ObligationStatusEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ObligationStatus> findByInvoice(UUID invoiceId) {
        return repository.findByObligationKindAndObligationIdOrderByMonthYearAsc(
                ObligationKind.CREDIT_CARD_INVOICE, invoiceId).stream()
            .map(ObligationStatusEntity::toDomain)
            .toList();
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    private ObligationStatus insert(ObligationStatus status) {
        ObligationRef ref = status.getRef();
        if (repository.existsByObligationKindAndObligationIdAndMonthYear(
                ref.getKind(), ref.getId(), status.getMonthYear())) {
            throw new DuplicateObligationPeriodException(ref, status.getMonthYear());
        }

        ObligationStatus saved;
        try {
            saved = repository.saveAndFlush(ObligationStatusEntity.fromDomain(status)).toDomain();
        } catch (DataIntegrityViolationException e) {
            // A concurrent writer committed the same (ref, month) after the pre-check
            throw new DuplicateObligationPeriodException(ref, status.getMonthYear(), e);
        }

        outboxService.saveEvent(AggregateType.OBLIGATION_STATUS, saved.getId(),
            ObligationScheduledEvent.EVENT_TYPE, ObligationScheduledEvent.fromStatus(saved));
        log.info("Scheduled ledger entry: id={}, ref={}, month={}, due={}",
            saved.getId(), ref, saved.getMonthYear(), saved.getDueDate());
        return saved;
    }

    private void requireObligationExists(ObligationRef ref) {
        boolean exists = switch (ref.getKind()) {
            case FIXED -> fixedPaymentService.exists(ref.getId());
            case VARIABLE -> variablePaymentService.exists(ref.getId());
            case CREDIT_CARD_INVOICE -> invoiceLifecycleService.findById(ref.getId()).isPresent();
        };
        if (!exists) {
            throw new ResourceNotFoundException("Obligation " + ref.getKind(), ref.getId());
        }
    }

    // Invoice totals are summed without conversion, in the card's currency
    private void requireInvoiceCurrency(ObligationRef ref, CurrencyCode currency) {
        if (ref.getKind() != ObligationKind.CREDIT_CARD_INVOICE) {
            return;
        }
        CurrencyCode cardCurrency = invoiceLifecycleService.currencyOf(ref.getId());
        if (cardCurrency != currency) {
            throw new IllegalArgumentException("Invoice " + ref.getId() + " is billed in " + cardCurrency
                + ", entry currency was " + currency);
        }
    }

    private ObligationStatusEntity lockEntry(UUID statusId) {
        return repository.findByIdForUpdate(statusId)
            .orElseThrow(() -> new ResourceNotFoundException("Obligation status", statusId));
    }
}

package com.flagship.finance_tracker.invoice;

import com.flagship.finance_tracker.billing.BillingPeriod;
import com.flagship.finance_tracker.billing.BillingPeriodCalculator;
import com.flagship.finance_tracker.card.CreditCard;
import com.flagship.finance_tracker.card.CreditCardService;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.common.ResourceNotFoundException;
import com.flagship.finance_tracker.invoice.event.InvoiceClosedEvent;
import com.flagship.finance_tracker.invoice.event.InvoiceOpenedEvent;
import com.flagship.finance_tracker.observability.CorrelationContext;
import com.flagship.finance_tracker.observability.LedgerMetrics;
import com.flagship.finance_tracker.outbox.AggregateType;
import com.flagship.finance_tracker.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Open/close lifecycle of credit card invoices.
 *
 * Invariants kept here:
 * 1. Invoices of a card are contiguous: each successor starts the day after
 *    its predecessor ends.
 * 2. A card has at most one open invoice, and after its first invoice exists
 *    it always has exactly one.
 * 3. Closing and opening the successor commit together or not at all.
 *
 * Totals are derived from the ledger on every read and never stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceLifecycleService {

    private final CreditCardInvoiceRepository invoiceRepository;
    private final CreditCardService creditCardService;
    private final BillingPeriodCalculator billingPeriodCalculator;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Bootstraps the first invoice of a card, covering the calendar month of
     * {@code anchorDate} (today when null).
     *
     * @throws IllegalStateException if the card is inactive or already has invoices
     */
    @Transactional
    public CreditCardInvoice createInitialInvoice(UUID cardId, LocalDate anchorDate) {
        MDC.put(CorrelationContext.CARD_ID_MDC_KEY, cardId.toString());
        try {
            // The card lock serializes concurrent bootstraps of the same card
            CreditCard card = creditCardService.lockForUpdate(cardId);
            if (!card.isActive()) {
                throw new IllegalStateException("Credit card " + cardId + " is not active");
            }
            if (invoiceRepository.existsByCreditCardId(cardId)) {
                throw new IllegalStateException("Invoices already exist for credit card " + cardId);
            }

            LocalDate anchor = anchorDate != null ? anchorDate : LocalDate.now(clock);
            BillingPeriod period = billingPeriodCalculator.period(anchor);
            CreditCardInvoice invoice = CreditCardInvoice.open(UUID.randomUUID(), cardId, period);
            CreditCardInvoice saved = invoiceRepository.save(CreditCardInvoiceEntity.fromDomain(invoice)).toDomain();

            outboxService.saveEvent(AggregateType.CREDIT_CARD_INVOICE, saved.getId(),
                InvoiceOpenedEvent.EVENT_TYPE, InvoiceOpenedEvent.fromInvoice(saved));
            ledgerMetrics.recordInvoiceOpened(card.getCurrency().name());

            log.info("Opened initial invoice: invoiceId={}, period={}..{}",
                saved.getId(), period.getStartDate(), period.getEndDate());
            return saved;
        } finally {
            MDC.remove(CorrelationContext.CARD_ID_MDC_KEY);
        }
    }

    /**
     * Closes an open invoice and opens its successor for the next calendar
     * month, in one transaction.
     *
     * The invoice row is locked for the whole operation, so of two
     * concurrent closes exactly one succeeds; the other sees the committed
     * close and fails with {@link AlreadyClosedException}.
     *
     * @throws AlreadyClosedException if the invoice is already closed
     */
    @Transactional
    public InvoiceRollover close(UUID invoiceId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId.toString());

        try {
            CreditCardInvoiceEntity entity = invoiceRepository.findByIdForUpdate(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));

            CreditCardInvoice closed = entity.toDomain().close(Instant.now(clock));
            entity.updateFromDomain(closed);
            invoiceRepository.save(entity);

            BillingPeriod nextPeriod = billingPeriodCalculator.next(closed.getPeriod());
            CreditCardInvoice successor = CreditCardInvoice.open(
                UUID.randomUUID(), closed.getCreditCardId(), nextPeriod);
            CreditCardInvoice savedSuccessor = invoiceRepository
                .save(CreditCardInvoiceEntity.fromDomain(successor))
                .toDomain();

            InvoiceRollover rollover = new InvoiceRollover(closed, savedSuccessor);
            outboxService.saveEvent(AggregateType.CREDIT_CARD_INVOICE, invoiceId,
                InvoiceClosedEvent.EVENT_TYPE, InvoiceClosedEvent.fromRollover(rollover));

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordInvoiceClosed("success");
            ledgerMetrics.recordLatency("close_invoice", duration);
            log.info("Invoice closed: successorId={}, successorPeriod={}..{}, duration={}ms",
                savedSuccessor.getId(), nextPeriod.getStartDate(), nextPeriod.getEndDate(), duration);

            return rollover;

        } catch (AlreadyClosedException e) {
            ledgerMetrics.recordInvoiceClosed("already_closed");
            log.warn("Rejected close of an already closed invoice");
            throw e;
        } catch (ResourceNotFoundException e) {
            ledgerMetrics.recordInvoiceClosed("not_found");
            log.warn("Rejected close of an unknown invoice");
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordInvoiceClosed("error");
            log.error("Invoice close failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Optional<CreditCardInvoice> findById(UUID invoiceId) {
        return invoiceRepository.findById(invoiceId).map(CreditCardInvoiceEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public CreditCardInvoice getById(UUID invoiceId) {
        return findById(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    /**
     * Currency the invoice is billed in, which is its card's currency.
     */
    @Transactional(readOnly = true)
    public CurrencyCode currencyOf(UUID invoiceId) {
        CreditCardInvoice invoice = getById(invoiceId);
        return creditCardService.getById(invoice.getCreditCardId()).getCurrency();
    }

    @Transactional(readOnly = true)
    public Optional<CreditCardInvoice> openInvoiceFor(UUID cardId) {
        return invoiceRepository.findFirstByCreditCardIdAndClosedFalse(cardId)
            .map(CreditCardInvoiceEntity::toDomain);
    }

    /**
     * Closed invoices of a card, most recent period first.
     */
    @Transactional(readOnly = true)
    public List<CreditCardInvoice> closedInvoicesFor(UUID cardId) {
        return invoiceRepository.findByCreditCardIdAndClosedTrueOrderByStartDateDesc(cardId).stream()
            .map(CreditCardInvoiceEntity::toDomain)
            .toList();
    }

    /**
     * Full invoice history of a card in period order.
     */
    @Transactional(readOnly = true)
    public List<CreditCardInvoice> invoicesFor(UUID cardId) {
        return invoiceRepository.findByCreditCardIdOrderByStartDateAsc(cardId).stream()
            .map(CreditCardInvoiceEntity::toDomain)
            .toList();
    }

    /**
     * Total and count of the ledger entries that reference this invoice.
     * The total sums expected amounts, whether or not the entries are paid.
     * Entries are only accepted in the card's currency, so no conversion
     * happens here.
     */
    @Transactional(readOnly = true)
    public InvoiceTotals totals(UUID invoiceId) {
        CreditCardInvoice invoice = getById(invoiceId);
        CurrencyCode currency = creditCardService.getById(invoice.getCreditCardId()).getCurrency();

        Map<String, Object> row = jdbcTemplate.queryForMap(
            "SELECT COALESCE(SUM(expected_amount), 0) AS total, COUNT(*) AS purchases " +
            "FROM obligation_statuses " +
            "WHERE obligation_kind = 'CREDIT_CARD_INVOICE' AND obligation_id = ?",
            invoiceId
        );

        BigDecimal total = (BigDecimal) row.get("total");
        long purchases = ((Number) row.get("purchases")).longValue();

        return new InvoiceTotals(
            invoiceId,
            total != null ? total : BigDecimal.ZERO,
            currency,
            purchases,
            invoice.getBillingPeriodDays()
        );
    }
}

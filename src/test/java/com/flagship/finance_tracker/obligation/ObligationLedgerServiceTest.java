package com.flagship.finance_tracker.obligation;

import com.flagship.finance_tracker.card.CreditCard;
import com.flagship.finance_tracker.card.CreditCardService;
import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.common.ResourceNotFoundException;
import com.flagship.finance_tracker.invoice.CreditCardInvoice;
import com.flagship.finance_tracker.invoice.InvoiceLifecycleService;
import com.flagship.finance_tracker.obligation.event.ObligationPaidEvent;
import com.flagship.finance_tracker.obligation.event.ObligationScheduledEvent;
import com.flagship.finance_tracker.outbox.AggregateType;
import com.flagship.finance_tracker.outbox.OutboxEvent;
import com.flagship.finance_tracker.outbox.OutboxService;
import com.flagship.finance_tracker.payment.ExpenseCategory;
import com.flagship.finance_tracker.payment.FixedPayment;
import com.flagship.finance_tracker.payment.FixedPaymentService;
import com.flagship.finance_tracker.payment.PaymentFrequency;
import com.flagship.finance_tracker.payment.VariablePayment;
import com.flagship.finance_tracker.payment.VariablePaymentService;
import com.flagship.finance_tracker.support.PostgresIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger scheduling, settlement and queries against a real database.
 *
 * The database is shared by all integration tests, so every test works in
 * months no other test touches and asserts on its own entries only.
 */
class ObligationLedgerServiceTest extends PostgresIntegrationTest {

    @Autowired
    private ObligationLedgerService ledgerService;

    @Autowired
    private FixedPaymentService fixedPaymentService;

    @Autowired
    private VariablePaymentService variablePaymentService;

    @Autowired
    private CreditCardService creditCardService;

    @Autowired
    private InvoiceLifecycleService invoiceLifecycleService;

    @Autowired
    private OutboxService outboxService;

    private FixedPayment rent(LocalDate start, LocalDate end) {
        return fixedPaymentService.create("Rent", new BigDecimal("900.00"), CurrencyCode.EUR,
            Country.PORTUGAL, PaymentFrequency.MONTHLY, start, end);
    }

    private Set<UUID> idsOf(List<ObligationStatus> statuses) {
        return statuses.stream().map(ObligationStatus::getId).collect(Collectors.toSet());
    }

    @Test
    @DisplayName("Scheduling stores an unpaid entry and writes an outbox event")
    void testSchedule_Success() {
        printTestHeader("Schedule ledger entry");
        FixedPayment payment = rent(LocalDate.of(2019, 1, 10), LocalDate.of(2019, 12, 31));

        ObligationStatus status = ledgerService.schedule(ObligationRef.fixed(payment.getId()),
            YearMonth.of(2019, 2), LocalDate.of(2019, 2, 10), new BigDecimal("900.00"), CurrencyCode.EUR, "February");

        assertNotNull(status.getId());
        assertFalse(status.isPaid());
        assertNull(status.getPaidDate());
        assertNull(status.getActualAmount());
        assertEquals(ObligationKind.FIXED, status.getRef().getKind());
        assertEquals("February", status.getNotes());

        ObligationStatus loaded = ledgerService.findById(status.getId()).orElseThrow();
        assertEquals(status, loaded);

        List<OutboxEvent> events = outboxService.getEventsForAggregate(AggregateType.OBLIGATION_STATUS, status.getId());
        assertEquals(1, events.size());
        assertEquals(ObligationScheduledEvent.EVENT_TYPE, events.get(0).getEventType());
        printSuccess("Entry scheduled: " + status.getRef());
    }

    @Test
    @DisplayName("A second entry for the same obligation and month is rejected")
    void testSchedule_DuplicatePeriod() {
        FixedPayment payment = rent(LocalDate.of(2019, 1, 10), LocalDate.of(2019, 12, 31));
        ObligationRef ref = ObligationRef.fixed(payment.getId());
        ledgerService.schedule(ref, YearMonth.of(2019, 3), LocalDate.of(2019, 3, 10),
            new BigDecimal("900.00"), CurrencyCode.EUR, null);

        DuplicateObligationPeriodException e = assertThrows(DuplicateObligationPeriodException.class,
            () -> ledgerService.schedule(ref, YearMonth.of(2019, 3), LocalDate.of(2019, 3, 20),
                new BigDecimal("950.00"), CurrencyCode.EUR, null));
        assertEquals(ref, e.getRef());
        assertEquals(YearMonth.of(2019, 3), e.getMonthYear());

        // Other months are fine
        assertDoesNotThrow(() -> ledgerService.schedule(ref, YearMonth.of(2019, 4), LocalDate.of(2019, 4, 10),
            new BigDecimal("900.00"), CurrencyCode.EUR, null));
    }

    @Test
    @DisplayName("Referencing an obligation that does not exist is rejected")
    void testSchedule_UnknownObligation() {
        assertThrows(ResourceNotFoundException.class,
            () -> ledgerService.schedule(ObligationRef.variable(UUID.randomUUID()), YearMonth.of(2019, 5),
                LocalDate.of(2019, 5, 1), BigDecimal.TEN, CurrencyCode.BRL, null));
        assertThrows(ResourceNotFoundException.class,
            () -> ledgerService.schedule(ObligationRef.invoice(UUID.randomUUID()), YearMonth.of(2019, 5),
                LocalDate.of(2019, 5, 1), BigDecimal.TEN, CurrencyCode.BRL, null));
    }

    @Test
    @DisplayName("markPaid defaults to the expected amount; markPending clears the payment")
    void testMarkPaidAndPending() {
        printTestHeader("Mark paid / pending");
        VariablePayment dinner = variablePaymentService.record(LocalDate.of(2019, 6, 3), "Dinner",
            new BigDecimal("80.00"), CurrencyCode.EUR, Country.PORTUGAL, ExpenseCategory.FOOD, null);
        ObligationStatus status = ledgerService.schedule(ObligationRef.variable(dinner.getId()),
            YearMonth.of(2019, 6), LocalDate.of(2019, 6, 3), dinner.getAmount(), CurrencyCode.EUR, null);

        ObligationStatus paid = ledgerService.markPaid(status.getId(), null, LocalDate.of(2019, 6, 4));
        assertTrue(paid.isPaid());
        assertEquals(0, new BigDecimal("80.00").compareTo(paid.getActualAmount()));
        assertEquals(LocalDate.of(2019, 6, 4), paid.getPaidDate());
        assertEquals(ObligationState.PAID, paid.stateOn(ledgerService.today()));

        ObligationStatus pending = ledgerService.markPending(status.getId());
        assertFalse(pending.isPaid());
        assertNull(pending.getPaidDate());
        assertNull(pending.getActualAmount());
        // Due in 2019, so reopening makes it overdue
        assertEquals(ObligationState.OVERDUE, pending.stateOn(ledgerService.today()));

        ObligationStatus reloaded = ledgerService.findById(status.getId()).orElseThrow();
        assertFalse(reloaded.isPaid());

        List<OutboxEvent> events = outboxService.getEventsForAggregate(AggregateType.OBLIGATION_STATUS, status.getId());
        assertEquals(3, events.size());
        assertTrue(events.stream().anyMatch(e -> ObligationPaidEvent.EVENT_TYPE.equals(e.getEventType())));
        printSuccess("Entry paid and reopened");
    }

    @Test
    @DisplayName("markPaid with no date uses today and keeps a different actual amount")
    void testMarkPaid_DefaultsToToday() {
        FixedPayment payment = rent(LocalDate.of(2019, 1, 10), LocalDate.of(2019, 12, 31));
        ObligationStatus status = ledgerService.schedule(ObligationRef.fixed(payment.getId()),
            YearMonth.of(2019, 7), LocalDate.of(2019, 7, 10), new BigDecimal("900.00"), CurrencyCode.EUR, null);

        ObligationStatus paid = ledgerService.markPaid(status.getId(), new BigDecimal("905.50"), null);

        assertEquals(ledgerService.today(), paid.getPaidDate());
        assertEquals(0, new BigDecimal("905.50").compareTo(paid.getActualAmount()));
        assertEquals(0, new BigDecimal("900.00").compareTo(paid.getExpectedAmount()));
    }

    @Test
    @DisplayName("Settling an unknown entry is reported as not found")
    void testMarkPaid_UnknownEntry() {
        assertThrows(ResourceNotFoundException.class,
            () -> ledgerService.markPaid(UUID.randomUUID(), null, null));
        assertThrows(ResourceNotFoundException.class,
            () -> ledgerService.markPending(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Filters combine state, period, kind and invoice")
    void testFind_Filters() {
        printTestHeader("Ledger filters");
        YearMonth past = YearMonth.of(2020, 9);
        YearMonth future = YearMonth.of(2099, 1);

        FixedPayment gym = fixedPaymentService.create("Gym", new BigDecimal("40.00"), CurrencyCode.EUR,
            Country.PORTUGAL, PaymentFrequency.MONTHLY, LocalDate.of(2020, 9, 1), LocalDate.of(2099, 12, 31));
        VariablePayment groceries = variablePaymentService.record(LocalDate.of(2020, 9, 12), "Groceries",
            new BigDecimal("120.00"), CurrencyCode.EUR, Country.PORTUGAL, ExpenseCategory.FOOD, null);
        CreditCard card = creditCardService.register(Country.BRAZIL, CurrencyCode.BRL,
            new BigDecimal("2.99"), new BigDecimal("6.38"), "Filter Tester", "1111");
        CreditCardInvoice invoice = invoiceLifecycleService.createInitialInvoice(card.getId(), LocalDate.of(2020, 8, 1));

        ObligationStatus overdueFixed = ledgerService.schedule(ObligationRef.fixed(gym.getId()), past,
            LocalDate.of(2020, 9, 1), gym.getAmount(), CurrencyCode.EUR, null);
        ObligationStatus paidVariable = ledgerService.schedule(ObligationRef.variable(groceries.getId()), past,
            LocalDate.of(2020, 9, 12), groceries.getAmount(), CurrencyCode.EUR, null);
        ledgerService.markPaid(paidVariable.getId(), null, LocalDate.of(2020, 9, 12));
        ObligationStatus overdueInvoice = ledgerService.schedule(ObligationRef.invoice(invoice.getId()), past,
            LocalDate.of(2020, 9, 10), new BigDecimal("700.00"), CurrencyCode.BRL, null);
        ObligationStatus pendingFixed = ledgerService.schedule(ObligationRef.fixed(gym.getId()), future,
            LocalDate.of(2099, 1, 1), gym.getAmount(), CurrencyCode.EUR, null);

        Set<UUID> byPeriod = idsOf(ledgerService.find(ObligationStatusFilter.builder().period(past).build()));
        assertEquals(Set.of(overdueFixed.getId(), paidVariable.getId(), overdueInvoice.getId()), byPeriod);

        Set<UUID> overdueInPast = idsOf(ledgerService.find(ObligationStatusFilter.builder()
            .period(past).state(ObligationState.OVERDUE).build()));
        assertEquals(Set.of(overdueFixed.getId(), overdueInvoice.getId()), overdueInPast);

        Set<UUID> paidInPast = idsOf(ledgerService.find(ObligationStatusFilter.builder()
            .period(past).state(ObligationState.PAID).build()));
        assertEquals(Set.of(paidVariable.getId()), paidInPast);

        Set<UUID> pendingInFuture = idsOf(ledgerService.find(ObligationStatusFilter.builder()
            .period(future).state(ObligationState.PENDING).build()));
        assertEquals(Set.of(pendingFixed.getId()), pendingInFuture);

        Set<UUID> fixedInPast = idsOf(ledgerService.find(ObligationStatusFilter.builder()
            .period(past).kind(ObligationKind.FIXED).build()));
        assertEquals(Set.of(overdueFixed.getId()), fixedInPast);

        Set<UUID> forInvoice = idsOf(ledgerService.find(ObligationStatusFilter.builder()
            .invoiceId(invoice.getId()).build()));
        assertEquals(Set.of(overdueInvoice.getId()), forInvoice);
        assertEquals(forInvoice, idsOf(ledgerService.findByInvoice(invoice.getId())));

        // Ordered by due date
        List<ObligationStatus> ordered = ledgerService.find(ObligationStatusFilter.builder().period(past).build());
        for (int i = 1; i < ordered.size(); i++) {
            assertFalse(ordered.get(i).getDueDate().isBefore(ordered.get(i - 1).getDueDate()));
        }
        printSuccess("All filter combinations matched");
    }

    @Test
    @DisplayName("Scheduling fixed payments creates missing entries only")
    void testScheduleFixedPayments_SkipsExisting() {
        printTestHeader("Schedule fixed payments for a month");
        YearMonth month = YearMonth.of(2018, 4);
        FixedPayment internet = fixedPaymentService.create("Internet", new BigDecimal("35.00"), CurrencyCode.EUR,
            Country.PORTUGAL, PaymentFrequency.MONTHLY, LocalDate.of(2018, 1, 31), LocalDate.of(2018, 6, 30));
        FixedPayment insurance = fixedPaymentService.create("Insurance", new BigDecimal("300.00"), CurrencyCode.BRL,
            Country.BRAZIL, PaymentFrequency.YEARLY, LocalDate.of(2018, 4, 5), null);
        FixedPayment notThisMonth = fixedPaymentService.create("Domain", new BigDecimal("12.00"), CurrencyCode.EUR,
            Country.PORTUGAL, PaymentFrequency.YEARLY, LocalDate.of(2018, 5, 5), null);

        List<ObligationStatus> created = ledgerService.scheduleFixedPayments(month);
        Set<UUID> createdRefs = created.stream().map(s -> s.getRef().getId()).collect(Collectors.toSet());
        assertTrue(createdRefs.contains(internet.getId()));
        assertTrue(createdRefs.contains(insurance.getId()));
        assertFalse(createdRefs.contains(notThisMonth.getId()));

        ObligationStatus internetEntry = created.stream()
            .filter(s -> s.getRef().getId().equals(internet.getId()))
            .findFirst()
            .orElseThrow();
        // Day 31 clamped to April's 30
        assertEquals(LocalDate.of(2018, 4, 30), internetEntry.getDueDate());

        List<ObligationStatus> again = ledgerService.scheduleFixedPayments(month);
        assertTrue(again.stream().noneMatch(s -> s.getRef().getId().equals(internet.getId())));
        assertTrue(again.stream().noneMatch(s -> s.getRef().getId().equals(insurance.getId())));
        printSuccess("Second run created nothing for existing entries");
    }
}

package com.flagship.finance_tracker.obligation;

import com.flagship.finance_tracker.common.CurrencyCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ObligationStatusTest {

    private static final LocalDate DUE = LocalDate.of(2024, 3, 10);

    private ObligationStatus scheduled() {
        return ObligationStatus.schedule(UUID.randomUUID(), ObligationRef.fixed(UUID.randomUUID()),
            YearMonth.of(2024, 3), DUE, new BigDecimal("120.00"), CurrencyCode.EUR, "rent");
    }

    @Test
    @DisplayName("Unpaid entry is pending up to and including its due date")
    void testState_PendingUntilDueDate() {
        ObligationStatus status = scheduled();

        assertEquals(ObligationState.PENDING, status.stateOn(DUE.minusDays(1)));
        assertEquals(ObligationState.PENDING, status.stateOn(DUE));
        assertFalse(status.isOverdue(DUE));
    }

    @Test
    @DisplayName("Unpaid entry is overdue the day after its due date")
    void testState_OverdueAfterDueDate() {
        ObligationStatus status = scheduled();

        assertTrue(status.isOverdue(DUE.plusDays(1)));
        assertEquals(ObligationState.OVERDUE, status.stateOn(DUE.plusDays(1)));
    }

    @Test
    @DisplayName("Mark paid defaults actual amount to expected and paid date to today")
    void testMarkPaid_Defaults() {
        LocalDate today = LocalDate.of(2024, 3, 20);

        ObligationStatus paid = scheduled().markPaid(null, null, today);

        assertTrue(paid.isPaid());
        assertEquals(new BigDecimal("120.00"), paid.getActualAmount());
        assertEquals(today, paid.getPaidDate());
        assertEquals(ObligationState.PAID, paid.stateOn(today));
        assertFalse(paid.isOverdue(today));
    }

    @Test
    @DisplayName("Mark paid keeps an explicit amount and date")
    void testMarkPaid_Explicit() {
        ObligationStatus paid = scheduled().markPaid(new BigDecimal("118.40"), DUE.minusDays(2), DUE);

        assertEquals(new BigDecimal("118.40"), paid.getActualAmount());
        assertEquals(DUE.minusDays(2), paid.getPaidDate());
        assertEquals(new BigDecimal("118.40"), paid.getEffectiveAmount());
        assertEquals(DUE.minusDays(2), paid.getRateDate());
    }

    @Test
    @DisplayName("Mark pending clears paid date and actual amount")
    void testMarkPending_ClearsSettlement() {
        ObligationStatus reopened = scheduled()
            .markPaid(new BigDecimal("99.00"), DUE, DUE)
            .markPending();

        assertFalse(reopened.isPaid());
        assertNull(reopened.getPaidDate());
        assertNull(reopened.getActualAmount());
        assertEquals(new BigDecimal("120.00"), reopened.getEffectiveAmount());
        assertEquals(DUE, reopened.getRateDate());
    }

    @Test
    @DisplayName("Negative amounts are rejected")
    void testNegativeAmounts() {
        assertThrows(IllegalArgumentException.class, () -> ObligationStatus.schedule(UUID.randomUUID(),
            ObligationRef.fixed(UUID.randomUUID()), YearMonth.of(2024, 3), DUE,
            new BigDecimal("-1.00"), CurrencyCode.EUR, null));
        assertThrows(IllegalArgumentException.class,
            () -> scheduled().markPaid(new BigDecimal("-5.00"), null, DUE));
    }
}

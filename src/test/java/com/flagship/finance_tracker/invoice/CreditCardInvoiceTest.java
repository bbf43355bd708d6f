package com.flagship.finance_tracker.invoice;

import com.flagship.finance_tracker.billing.BillingPeriod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CreditCardInvoiceTest {

    private final BillingPeriod january = new BillingPeriod(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

    @Test
    @DisplayName("A new invoice is open and knows its period length")
    void testOpen() {
        CreditCardInvoice invoice = CreditCardInvoice.open(UUID.randomUUID(), UUID.randomUUID(), january);

        assertEquals(InvoiceState.OPEN, invoice.getState());
        assertNull(invoice.getClosedAt());
        assertEquals(31, invoice.getBillingPeriodDays());
    }

    @Test
    @DisplayName("Close returns a closed copy and leaves the original untouched")
    void testClose() {
        CreditCardInvoice open = CreditCardInvoice.open(UUID.randomUUID(), UUID.randomUUID(), january);
        Instant closedAt = Instant.parse("2024-02-01T00:00:00Z");

        CreditCardInvoice closed = open.close(closedAt);

        assertEquals(InvoiceState.CLOSED, closed.getState());
        assertEquals(closedAt, closed.getClosedAt());
        assertEquals(open.getId(), closed.getId());
        assertEquals(InvoiceState.OPEN, open.getState());
    }

    @Test
    @DisplayName("Closing twice fails with AlreadyClosedException")
    void testClose_AlreadyClosed() {
        CreditCardInvoice closed = CreditCardInvoice.open(UUID.randomUUID(), UUID.randomUUID(), january)
            .close(Instant.now());

        AlreadyClosedException exception = assertThrows(AlreadyClosedException.class,
            () -> closed.close(Instant.now()));
        assertEquals(closed.getId(), exception.getInvoiceId());
    }
}

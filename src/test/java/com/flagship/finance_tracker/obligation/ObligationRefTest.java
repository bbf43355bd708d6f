package com.flagship.finance_tracker.obligation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ObligationRefTest {

    @Test
    @DisplayName("Exactly one id gives a ref of the matching kind")
    void testOfExclusive_SingleId() {
        UUID id = UUID.randomUUID();

        assertEquals(ObligationRef.fixed(id), ObligationRef.ofExclusive(id, null, null));
        assertEquals(ObligationKind.VARIABLE, ObligationRef.ofExclusive(null, id, null).getKind());
        assertEquals(ObligationKind.CREDIT_CARD_INVOICE, ObligationRef.ofExclusive(null, null, id).getKind());
    }

    @Test
    @DisplayName("No id at all is rejected")
    void testOfExclusive_None() {
        assertThrows(InvalidObligationReferenceException.class,
            () -> ObligationRef.ofExclusive(null, null, null));
    }

    @Test
    @DisplayName("Two or three ids are rejected")
    void testOfExclusive_Several() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();

        assertThrows(InvalidObligationReferenceException.class,
            () -> ObligationRef.ofExclusive(a, b, null));
        assertThrows(InvalidObligationReferenceException.class,
            () -> ObligationRef.ofExclusive(a, null, b));
        assertThrows(InvalidObligationReferenceException.class,
            () -> ObligationRef.ofExclusive(a, b, UUID.randomUUID()));
    }

    @Test
    @DisplayName("Kind and id are both required")
    void testConstructor_RequiresBothParts() {
        assertThrows(InvalidObligationReferenceException.class,
            () -> new ObligationRef(null, UUID.randomUUID()));
        assertThrows(InvalidObligationReferenceException.class,
            () -> new ObligationRef(ObligationKind.FIXED, null));
    }
}

package com.flagship.finance_tracker.obligation;

import lombok.Value;

import java.util.UUID;

/**
 * Reference from a ledger entry to exactly one obligation: a fixed payment,
 * a variable payment or a credit card invoice.
 *
 * The kind and id travel together, so "no reference" and "two references"
 * cannot be represented once a ref exists.
 */
@Value
public class ObligationRef {
    ObligationKind kind;
    UUID id;

    public ObligationRef(ObligationKind kind, UUID id) {
        if (kind == null || id == null) {
            throw new InvalidObligationReferenceException("Obligation kind and id are both required");
        }
        this.kind = kind;
        this.id = id;
    }

    public static ObligationRef fixed(UUID fixedPaymentId) {
        return new ObligationRef(ObligationKind.FIXED, fixedPaymentId);
    }

    public static ObligationRef variable(UUID variablePaymentId) {
        return new ObligationRef(ObligationKind.VARIABLE, variablePaymentId);
    }

    public static ObligationRef invoice(UUID invoiceId) {
        return new ObligationRef(ObligationKind.CREDIT_CARD_INVOICE, invoiceId);
    }

    /**
     * Builds a ref from three optional ids of which exactly one must be set.
     *
     * @throws InvalidObligationReferenceException when none or several are set
     */
    public static ObligationRef ofExclusive(UUID fixedPaymentId, UUID variablePaymentId, UUID invoiceId) {
        int present = (fixedPaymentId != null ? 1 : 0)
            + (variablePaymentId != null ? 1 : 0)
            + (invoiceId != null ? 1 : 0);
        if (present != 1) {
            throw new InvalidObligationReferenceException(
                "Exactly one of fixed payment, variable payment or invoice must be referenced, got " + present);
        }
        if (fixedPaymentId != null) {
            return fixed(fixedPaymentId);
        }
        if (variablePaymentId != null) {
            return variable(variablePaymentId);
        }
        return invoice(invoiceId);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}

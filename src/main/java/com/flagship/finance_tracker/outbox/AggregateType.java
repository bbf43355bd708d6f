package com.flagship.finance_tracker.outbox;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Aggregates that emit events. The label is what is stored in
 * outbox_events.aggregate_type and decides the Kafka topic.
 */
@Getter
@RequiredArgsConstructor
public enum AggregateType {
    CREDIT_CARD_INVOICE("CreditCardInvoice"),
    OBLIGATION_STATUS("ObligationStatus");

    private final String label;

    public static AggregateType fromLabel(String label) {
        for (AggregateType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown aggregate type: " + label);
    }
}

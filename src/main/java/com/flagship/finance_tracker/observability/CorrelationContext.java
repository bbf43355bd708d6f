package com.flagship.finance_tracker.observability;

import java.util.UUID;

/**
 * Thread-local correlation id of the request being served.
 *
 * Set by {@link CorrelationIdFilter}, copied into the MDC for logging and
 * stored on every outbox event so Kafka consumers can trace a close or a
 * mark-paid back to the HTTP call that caused it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String INVOICE_ID_MDC_KEY = "invoiceId";
    public static final String CARD_ID_MDC_KEY = "cardId";
    public static final String OBLIGATION_ID_MDC_KEY = "obligationId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current id, generating one for work that did not start from a request
     * (schedulers, tests).
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}

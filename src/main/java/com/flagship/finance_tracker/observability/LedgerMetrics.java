package com.flagship.finance_tracker.observability;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for the billing and ledger core.
 *
 * - invoices.opened / invoices.closed{status}
 * - obligations.scheduled{kind,status}
 * - obligations.settled{kind,outcome} (outcome = paid | reopened)
 * - summary.missing_rate{pair}
 * - ledger.latency{operation}
 */
@Component
@RequiredArgsConstructor
public class LedgerMetrics {

    private final MeterRegistry registry;

    public void recordInvoiceOpened(String currency) {
        registry.counter("invoices.opened", "currency", sanitizeTag(currency)).increment();
    }

    public void recordInvoiceClosed(String status) {
        registry.counter("invoices.closed", "status", sanitizeTag(status)).increment();
    }

    public void recordObligationScheduled(String kind, String status) {
        registry.counter("obligations.scheduled",
            "kind", sanitizeTag(kind),
            "status", sanitizeTag(status)
        ).increment();
    }

    public void recordObligationSettled(String kind, String outcome) {
        registry.counter("obligations.settled",
            "kind", sanitizeTag(kind),
            "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordMissingRate(String fromCurrency, String toCurrency) {
        registry.counter("summary.missing_rate",
            "pair", sanitizeTag(fromCurrency + "_" + toCurrency)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency", "operation", sanitizeTag(operation))
            .record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values short and free of characters Prometheus rejects.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

package com.flagship.finance_tracker.obligation.event;

import com.flagship.finance_tracker.obligation.ObligationKind;

import java.time.Instant;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Facts about ledger entries, published through the outbox.
 */
public interface ObligationEvent {

    UUID getEventId();

    UUID getObligationStatusId();

    ObligationKind getObligationKind();

    UUID getObligationId();

    YearMonth getMonthYear();

    Instant getOccurredAt();

    String getEventType();
}

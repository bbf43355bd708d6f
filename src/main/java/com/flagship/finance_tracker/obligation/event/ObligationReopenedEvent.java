package com.flagship.finance_tracker.obligation.event;

import com.flagship.finance_tracker.obligation.ObligationKind;
import com.flagship.finance_tracker.obligation.ObligationStatus;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Published when a paid entry is reverted to pending.
 */
@Value
public class ObligationReopenedEvent implements ObligationEvent {
    UUID eventId;
    UUID obligationStatusId;
    ObligationKind obligationKind;
    UUID obligationId;
    YearMonth monthYear;
    LocalDate dueDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ObligationReopened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ObligationReopenedEvent fromStatus(ObligationStatus status) {
        return new ObligationReopenedEvent(
            UUID.randomUUID(),
            status.getId(),
            status.getRef().getKind(),
            status.getRef().getId(),
            status.getMonthYear(),
            status.getDueDate(),
            Instant.now()
        );
    }
}

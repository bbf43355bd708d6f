package com.flagship.finance_tracker.obligation.event;

import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.obligation.ObligationKind;
import com.flagship.finance_tracker.obligation.ObligationStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

@Value
public class ObligationScheduledEvent implements ObligationEvent {
    UUID eventId;
    UUID obligationStatusId;
    ObligationKind obligationKind;
    UUID obligationId;
    YearMonth monthYear;
    LocalDate dueDate;
    BigDecimal expectedAmount;
    CurrencyCode currency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ObligationScheduled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ObligationScheduledEvent fromStatus(ObligationStatus status) {
        return new ObligationScheduledEvent(
            UUID.randomUUID(),
            status.getId(),
            status.getRef().getKind(),
            status.getRef().getId(),
            status.getMonthYear(),
            status.getDueDate(),
            status.getExpectedAmount(),
            status.getCurrency(),
            Instant.now()
        );
    }
}

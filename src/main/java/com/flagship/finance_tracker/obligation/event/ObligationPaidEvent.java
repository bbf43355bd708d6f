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

/**
 * Published when an entry is marked paid, including re-marking an entry
 * that was already paid with a corrected amount or date.
 */
@Value
public class ObligationPaidEvent implements ObligationEvent {
    UUID eventId;
    UUID obligationStatusId;
    ObligationKind obligationKind;
    UUID obligationId;
    YearMonth monthYear;
    BigDecimal expectedAmount;
    BigDecimal actualAmount;
    CurrencyCode currency;
    LocalDate paidDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ObligationPaid";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ObligationPaidEvent fromStatus(ObligationStatus status) {
        return new ObligationPaidEvent(
            UUID.randomUUID(),
            status.getId(),
            status.getRef().getKind(),
            status.getRef().getId(),
            status.getMonthYear(),
            status.getExpectedAmount(),
            status.getActualAmount(),
            status.getCurrency(),
            status.getPaidDate(),
            Instant.now()
        );
    }
}

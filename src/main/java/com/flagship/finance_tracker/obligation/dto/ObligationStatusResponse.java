package com.flagship.finance_tracker.obligation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.obligation.ObligationKind;
import com.flagship.finance_tracker.obligation.ObligationState;
import com.flagship.finance_tracker.obligation.ObligationStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

@Value
@Builder
public class ObligationStatusResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("obligation_kind")
    ObligationKind obligationKind;

    @JsonProperty("obligation_id")
    UUID obligationId;

    @JsonProperty("month_year")
    YearMonth monthYear;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("expected_amount")
    BigDecimal expectedAmount;

    @JsonProperty("actual_amount")
    BigDecimal actualAmount;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("is_paid")
    boolean paid;

    @JsonProperty("paid_date")
    LocalDate paidDate;

    @JsonProperty("state")
    ObligationState state;

    @JsonProperty("notes")
    String notes;

    public static ObligationStatusResponse from(ObligationStatus status, LocalDate today) {
        return ObligationStatusResponse.builder()
            .id(status.getId())
            .obligationKind(status.getRef().getKind())
            .obligationId(status.getRef().getId())
            .monthYear(status.getMonthYear())
            .dueDate(status.getDueDate())
            .expectedAmount(status.getExpectedAmount())
            .actualAmount(status.getActualAmount())
            .currency(status.getCurrency())
            .paid(status.isPaid())
            .paidDate(status.getPaidDate())
            .state(status.stateOn(today))
            .notes(status.getNotes())
            .build();
    }
}

package com.flagship.finance_tracker.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.payment.FixedPayment;
import com.flagship.finance_tracker.payment.PaymentFrequency;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class FixedPaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("description")
    String description;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("country")
    Country country;

    @JsonProperty("frequency")
    PaymentFrequency frequency;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("is_active")
    boolean active;

    public static FixedPaymentResponse from(FixedPayment payment) {
        return FixedPaymentResponse.builder()
            .id(payment.getId())
            .description(payment.getDescription())
            .amount(payment.getAmount())
            .currency(payment.getCurrency())
            .country(payment.getCountry())
            .frequency(payment.getFrequency())
            .startDate(payment.getStartDate())
            .endDate(payment.getEndDate())
            .active(payment.isActive())
            .build();
    }
}

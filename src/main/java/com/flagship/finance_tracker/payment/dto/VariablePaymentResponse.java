package com.flagship.finance_tracker.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.payment.ExpenseCategory;
import com.flagship.finance_tracker.payment.VariablePayment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class VariablePaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("country")
    Country country;

    @JsonProperty("category")
    ExpenseCategory category;

    @JsonProperty("credit_card_id")
    UUID creditCardId;

    @JsonProperty("fx_fee_amount")
    BigDecimal fxFeeAmount;

    @JsonProperty("tax_fee_amount")
    BigDecimal taxFeeAmount;

    @JsonProperty("total_with_fees")
    BigDecimal totalWithFees;

    public static VariablePaymentResponse from(VariablePayment payment) {
        return VariablePaymentResponse.builder()
            .id(payment.getId())
            .date(payment.getDate())
            .description(payment.getDescription())
            .amount(payment.getAmount())
            .currency(payment.getCurrency())
            .country(payment.getCountry())
            .category(payment.getCategory())
            .creditCardId(payment.getCreditCardId())
            .fxFeeAmount(payment.getFxFeeAmount())
            .taxFeeAmount(payment.getTaxFeeAmount())
            .totalWithFees(payment.getTotalWithFees())
            .build();
    }
}

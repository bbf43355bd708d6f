package com.flagship.finance_tracker.profile.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.profile.FinancialProfile;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class FinancialProfileResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("base_currency")
    CurrencyCode baseCurrency;

    @JsonProperty("monthly_income_brl")
    BigDecimal monthlyIncomeBrl;

    @JsonProperty("monthly_income_eur")
    BigDecimal monthlyIncomeEur;

    public static FinancialProfileResponse from(FinancialProfile profile) {
        return FinancialProfileResponse.builder()
            .id(profile.getId())
            .name(profile.getName())
            .baseCurrency(profile.getBaseCurrency())
            .monthlyIncomeBrl(profile.getMonthlyIncomeBrl())
            .monthlyIncomeEur(profile.getMonthlyIncomeEur())
            .build();
    }
}

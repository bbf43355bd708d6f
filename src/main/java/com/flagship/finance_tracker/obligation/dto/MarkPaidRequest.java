package com.flagship.finance_tracker.obligation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Both fields are optional: the expected amount and today are used when absent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarkPaidRequest {

    @DecimalMin(value = "0.00", message = "Actual amount cannot be negative")
    @JsonProperty("actual_amount")
    private BigDecimal actualAmount;

    @JsonProperty("paid_date")
    private LocalDate paidDate;
}

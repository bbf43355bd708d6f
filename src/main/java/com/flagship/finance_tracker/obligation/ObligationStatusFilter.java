package com.flagship.finance_tracker.obligation;

import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;
import java.util.UUID;

/**
 * Combinable ledger query. Null fields do not restrict the result.
 */
@Value
@Builder
public class ObligationStatusFilter {
    ObligationState state;
    YearMonth period;
    ObligationKind kind;
    UUID invoiceId;

    public static ObligationStatusFilter all() {
        return ObligationStatusFilter.builder().build();
    }
}

package com.flagship.finance_tracker.summary;

import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.profile.FinancialProfile;
import com.flagship.finance_tracker.profile.FinancialProfileService;
import com.flagship.finance_tracker.summary.dto.PeriodSummaryResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.YearMonth;

/**
 * Monthly summary. Without {@code base}, the profile's base currency is
 * used, and EUR when there is no profile.
 */
@RestController
@RequestMapping("/api/summary")
@RequiredArgsConstructor
public class SummaryController {

    private final SummaryAggregator summaryAggregator;
    private final FinancialProfileService profileService;

    @GetMapping("/{monthYear}")
    public PeriodSummaryResponse summarize(
            @PathVariable("monthYear") YearMonth monthYear,
            @RequestParam(value = "base", required = false) CurrencyCode base) {
        CurrencyCode baseCurrency = base != null
            ? base
            : profileService.current().map(FinancialProfile::getBaseCurrency).orElse(CurrencyCode.EUR);
        return PeriodSummaryResponse.from(summaryAggregator.summarize(monthYear, baseCurrency));
    }
}

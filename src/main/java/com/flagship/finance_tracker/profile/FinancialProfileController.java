package com.flagship.finance_tracker.profile;

import com.flagship.finance_tracker.profile.dto.FinancialProfileRequest;
import com.flagship.finance_tracker.profile.dto.FinancialProfileResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/profile")
@RequiredArgsConstructor
public class FinancialProfileController {

    private final FinancialProfileService profileService;

    @GetMapping
    public ResponseEntity<FinancialProfileResponse> get() {
        return profileService.current()
            .map(profile -> ResponseEntity.ok(FinancialProfileResponse.from(profile)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping
    public FinancialProfileResponse save(@Valid @RequestBody FinancialProfileRequest request) {
        return FinancialProfileResponse.from(profileService.save(
            request.getName(),
            request.getBaseCurrency(),
            request.getMonthlyIncomeBrl(),
            request.getMonthlyIncomeEur()
        ));
    }
}

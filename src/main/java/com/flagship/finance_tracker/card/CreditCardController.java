package com.flagship.finance_tracker.card;

import com.flagship.finance_tracker.card.dto.CreateCreditCardRequest;
import com.flagship.finance_tracker.card.dto.CreditCardResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/cards")
@RequiredArgsConstructor
public class CreditCardController {

    private final CreditCardService creditCardService;

    @PostMapping
    public ResponseEntity<CreditCardResponse> register(@Valid @RequestBody CreateCreditCardRequest request) {
        CreditCard card = creditCardService.register(
            request.getIssuerCountry(),
            request.getCurrency(),
            request.getFxFeePercent(),
            request.getTaxPercent(),
            request.getCardholderName(),
            request.getFinalDigits()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(CreditCardResponse.from(card));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CreditCardResponse> get(@PathVariable("id") UUID id) {
        return creditCardService.findById(id)
            .map(card -> ResponseEntity.ok(CreditCardResponse.from(card)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/active")
    public List<CreditCardResponse> active() {
        return creditCardService.findActive().stream()
            .map(CreditCardResponse::from)
            .toList();
    }

    @PostMapping("/{id}/deactivate")
    public CreditCardResponse deactivate(@PathVariable("id") UUID id) {
        return CreditCardResponse.from(creditCardService.deactivate(id));
    }
}

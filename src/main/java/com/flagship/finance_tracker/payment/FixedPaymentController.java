package com.flagship.finance_tracker.payment;

import com.flagship.finance_tracker.payment.dto.CreateFixedPaymentRequest;
import com.flagship.finance_tracker.payment.dto.FixedPaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/fixed-payments")
@RequiredArgsConstructor
public class FixedPaymentController {

    private final FixedPaymentService fixedPaymentService;

    @PostMapping
    public ResponseEntity<FixedPaymentResponse> create(@Valid @RequestBody CreateFixedPaymentRequest request) {
        FixedPayment payment = fixedPaymentService.create(
            request.getDescription(),
            request.getAmount(),
            request.getCurrency(),
            request.getCountry(),
            request.getFrequency(),
            request.getStartDate(),
            request.getEndDate()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(FixedPaymentResponse.from(payment));
    }

    @GetMapping("/{id}")
    public ResponseEntity<FixedPaymentResponse> get(@PathVariable("id") UUID id) {
        return fixedPaymentService.findById(id)
            .map(payment -> ResponseEntity.ok(FixedPaymentResponse.from(payment)))
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Active payments, or only those due in {@code month} (yyyy-MM) when given.
     */
    @GetMapping
    public List<FixedPaymentResponse> list(
            @RequestParam(value = "month", required = false) YearMonth month) {
        List<FixedPayment> payments = month != null
            ? fixedPaymentService.findDueIn(month)
            : fixedPaymentService.findActive();
        return payments.stream().map(FixedPaymentResponse::from).toList();
    }

    @PostMapping("/{id}/deactivate")
    public FixedPaymentResponse deactivate(@PathVariable("id") UUID id) {
        return FixedPaymentResponse.from(fixedPaymentService.deactivate(id));
    }
}

package com.flagship.finance_tracker.payment;

import com.flagship.finance_tracker.payment.dto.RecordVariablePaymentRequest;
import com.flagship.finance_tracker.payment.dto.VariablePaymentResponse;
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
@RequestMapping("/api/variable-payments")
@RequiredArgsConstructor
public class VariablePaymentController {

    private final VariablePaymentService variablePaymentService;

    @PostMapping
    public ResponseEntity<VariablePaymentResponse> record(@Valid @RequestBody RecordVariablePaymentRequest request) {
        VariablePayment payment = variablePaymentService.record(
            request.getDate(),
            request.getDescription(),
            request.getAmount(),
            request.getCurrency(),
            request.getCountry(),
            request.getCategory(),
            request.getCreditCardId()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(VariablePaymentResponse.from(payment));
    }

    @GetMapping("/{id}")
    public ResponseEntity<VariablePaymentResponse> get(@PathVariable("id") UUID id) {
        return variablePaymentService.findById(id)
            .map(payment -> ResponseEntity.ok(VariablePaymentResponse.from(payment)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<VariablePaymentResponse> list(
            @RequestParam("month") YearMonth month) {
        return variablePaymentService.findIn(month).stream()
            .map(VariablePaymentResponse::from)
            .toList();
    }
}

package com.flagship.finance_tracker.obligation;

import com.flagship.finance_tracker.obligation.dto.MarkPaidRequest;
import com.flagship.finance_tracker.obligation.dto.ObligationStatusResponse;
import com.flagship.finance_tracker.obligation.dto.ScheduleObligationRequest;
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

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/obligations")
@RequiredArgsConstructor
public class ObligationLedgerController {

    private final ObligationLedgerService ledgerService;

    @PostMapping
    public ResponseEntity<ObligationStatusResponse> schedule(@Valid @RequestBody ScheduleObligationRequest request) {
        ObligationRef ref = ObligationRef.ofExclusive(
            request.getFixedPaymentId(), request.getVariablePaymentId(), request.getInvoiceId());
        ObligationStatus status = ledgerService.schedule(
            ref,
            request.getMonthYear(),
            request.getDueDate(),
            request.getExpectedAmount(),
            request.getCurrency(),
            request.getNotes()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ObligationStatusResponse.from(status, ledgerService.today()));
    }

    @PostMapping("/fixed/{monthYear}")
    public ResponseEntity<List<ObligationStatusResponse>> scheduleFixedPayments(
            @PathVariable("monthYear") YearMonth monthYear) {
        LocalDate today = ledgerService.today();
        List<ObligationStatusResponse> created = ledgerService.scheduleFixedPayments(monthYear).stream()
            .map(status -> ObligationStatusResponse.from(status, today))
            .toList();
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping("/{id}/paid")
    public ObligationStatusResponse markPaid(@PathVariable("id") UUID id,
                                             @Valid @RequestBody(required = false) MarkPaidRequest request) {
        ObligationStatus status = request != null
            ? ledgerService.markPaid(id, request.getActualAmount(), request.getPaidDate())
            : ledgerService.markPaid(id, null, null);
        return ObligationStatusResponse.from(status, ledgerService.today());
    }

    @PostMapping("/{id}/pending")
    public ObligationStatusResponse markPending(@PathVariable("id") UUID id) {
        return ObligationStatusResponse.from(ledgerService.markPending(id), ledgerService.today());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ObligationStatusResponse> get(@PathVariable("id") UUID id) {
        LocalDate today = ledgerService.today();
        return ledgerService.findById(id)
            .map(status -> ResponseEntity.ok(ObligationStatusResponse.from(status, today)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<ObligationStatusResponse> list(
            @RequestParam(value = "state", required = false) ObligationState state,
            @RequestParam(value = "period", required = false) YearMonth period,
            @RequestParam(value = "kind", required = false) ObligationKind kind,
            @RequestParam(value = "invoiceId", required = false) UUID invoiceId) {
        ObligationStatusFilter filter = ObligationStatusFilter.builder()
            .state(state)
            .period(period)
            .kind(kind)
            .invoiceId(invoiceId)
            .build();
        LocalDate today = ledgerService.today();
        return ledgerService.find(filter).stream()
            .map(status -> ObligationStatusResponse.from(status, today))
            .toList();
    }
}

package com.flagship.finance_tracker.invoice;

import com.flagship.finance_tracker.invoice.dto.InvoiceResponse;
import com.flagship.finance_tracker.invoice.dto.InvoiceRolloverResponse;
import com.flagship.finance_tracker.invoice.dto.InvoiceTotalsResponse;
import com.flagship.finance_tracker.invoice.dto.OpenInvoiceRequest;
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

/**
 * HTTP surface of the invoice lifecycle. Closing is the only mutation
 * besides the one-time bootstrap of a card's first invoice.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class InvoiceController {

    private final InvoiceLifecycleService lifecycleService;

    @PostMapping("/cards/{cardId}/invoices")
    public ResponseEntity<InvoiceResponse> createInitialInvoice(
            @PathVariable("cardId") UUID cardId,
            @RequestBody(required = false) OpenInvoiceRequest request) {
        CreditCardInvoice invoice = lifecycleService.createInitialInvoice(
            cardId, request != null ? request.getAnchorDate() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(InvoiceResponse.from(invoice));
    }

    @GetMapping("/cards/{cardId}/invoices")
    public List<InvoiceResponse> history(@PathVariable("cardId") UUID cardId) {
        return lifecycleService.invoicesFor(cardId).stream()
            .map(InvoiceResponse::from)
            .toList();
    }

    @GetMapping("/cards/{cardId}/invoices/open")
    public ResponseEntity<InvoiceResponse> openInvoice(@PathVariable("cardId") UUID cardId) {
        return lifecycleService.openInvoiceFor(cardId)
            .map(invoice -> ResponseEntity.ok(InvoiceResponse.from(invoice)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/cards/{cardId}/invoices/closed")
    public List<InvoiceResponse> closedInvoices(@PathVariable("cardId") UUID cardId) {
        return lifecycleService.closedInvoicesFor(cardId).stream()
            .map(InvoiceResponse::from)
            .toList();
    }

    @GetMapping("/invoices/{id}")
    public ResponseEntity<InvoiceResponse> get(@PathVariable("id") UUID id) {
        return lifecycleService.findById(id)
            .map(invoice -> ResponseEntity.ok(InvoiceResponse.from(invoice)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/invoices/{id}/close")
    public InvoiceRolloverResponse close(@PathVariable("id") UUID id) {
        return InvoiceRolloverResponse.from(lifecycleService.close(id));
    }

    @GetMapping("/invoices/{id}/totals")
    public InvoiceTotalsResponse totals(@PathVariable("id") UUID id) {
        return InvoiceTotalsResponse.from(lifecycleService.totals(id));
    }
}

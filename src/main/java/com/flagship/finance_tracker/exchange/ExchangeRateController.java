package com.flagship.finance_tracker.exchange;

import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.exchange.dto.CreateExchangeRateRequest;
import com.flagship.finance_tracker.exchange.dto.ExchangeRateResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/exchange-rates")
@RequiredArgsConstructor
public class ExchangeRateController {

    private final ExchangeRateService exchangeRateService;

    @PostMapping
    public ResponseEntity<ExchangeRateResponse> record(@Valid @RequestBody CreateExchangeRateRequest request) {
        ExchangeRate rate = exchangeRateService.record(
            request.getFromCurrency(),
            request.getToCurrency(),
            request.getRate(),
            request.getDate()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(ExchangeRateResponse.from(rate));
    }

    /**
     * All rates, or the history of one pair when both currencies are given.
     */
    @GetMapping
    public List<ExchangeRateResponse> list(
            @RequestParam(value = "from", required = false) CurrencyCode from,
            @RequestParam(value = "to", required = false) CurrencyCode to) {
        List<ExchangeRate> rates = from != null && to != null
            ? exchangeRateService.history(from, to)
            : exchangeRateService.findAll();
        return rates.stream().map(ExchangeRateResponse::from).toList();
    }

    /**
     * The rate the configured policy selects for a pair and date.
     */
    @GetMapping("/effective")
    public ResponseEntity<ExchangeRateResponse> effective(
            @RequestParam("from") CurrencyCode from,
            @RequestParam("to") CurrencyCode to,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return exchangeRateService.findRate(from, to, date)
            .map(rate -> ResponseEntity.ok(ExchangeRateResponse.from(rate)))
            .orElseThrow(() -> new MissingRateException(from, to, date));
    }
}

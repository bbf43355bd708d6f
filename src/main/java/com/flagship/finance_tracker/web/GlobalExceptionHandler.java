package com.flagship.finance_tracker.web;

import com.flagship.finance_tracker.common.ResourceNotFoundException;
import com.flagship.finance_tracker.exchange.MissingRateException;
import com.flagship.finance_tracker.invoice.AlreadyClosedException;
import com.flagship.finance_tracker.obligation.DuplicateObligationPeriodException;
import com.flagship.finance_tracker.obligation.InvalidObligationReferenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates the core's typed failures into HTTP responses.
 *
 * 400 bad input, 404 unknown resource, 409 state conflict,
 * 422 missing exchange rate, 500 anything unexpected.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", "Request could not be read", null);
    }

    @ExceptionHandler(InvalidObligationReferenceException.class)
    public ResponseEntity<ApiError> handleInvalidReference(InvalidObligationReferenceException e) {
        log.warn("Invalid obligation reference: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Obligation Reference", e.getMessage(), null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(AlreadyClosedException.class)
    public ResponseEntity<ApiError> handleAlreadyClosed(AlreadyClosedException e) {
        log.warn("Invoice already closed: invoiceId={}", e.getInvoiceId());
        return respond(HttpStatus.CONFLICT, "Invoice Already Closed", e.getMessage(), null);
    }

    @ExceptionHandler(DuplicateObligationPeriodException.class)
    public ResponseEntity<ApiError> handleDuplicate(DuplicateObligationPeriodException e) {
        log.warn("Duplicate ledger entry: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Duplicate Obligation Period", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(MissingRateException.class)
    public ResponseEntity<ApiError> handleMissingRate(MissingRateException e) {
        log.warn("Missing exchange rate: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Missing Exchange Rate", e.getMessage(), Map.of(
            "from_currency", e.getFromCurrency().name(),
            "to_currency", e.getToCurrency().name(),
            "date", e.getDate().toString()
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                             Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}

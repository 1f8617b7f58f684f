package com.minerpayout.api.controller;

import com.minerpayout.api.dto.ErrorBody;
import com.minerpayout.ledger.RpcException;
import com.minerpayout.payout.PayoutConfigurationException;
import com.minerpayout.payout.PayoutExecutionException;
import com.minerpayout.payout.ShareValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps exceptions to ErrorBody responses: invalid input 400, misconfiguration 500, failed payout 502,
 * unreachable ledger 503.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String LEDGER_UNAVAILABLE = "LEDGER_UNAVAILABLE";

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + " is missing or out of range")
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(HttpStatus.BAD_REQUEST, error, message));
    }

    @ExceptionHandler(ShareValidationException.class)
    public ResponseEntity<ErrorBody> handleInvalidShare(ShareValidationException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(PayoutExecutionException.class)
    public ResponseEntity<ErrorBody> handlePayoutFailed(PayoutExecutionException ex) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of(HttpStatus.BAD_GATEWAY, ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(PayoutConfigurationException.class)
    public ResponseEntity<ErrorBody> handleMisconfigured(PayoutConfigurationException ex) {
        log.error("Payout engine misconfigured: {}", ex.getMessage());
        return ResponseEntity.internalServerError()
                .body(ErrorBody.of(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(RpcException.class)
    public ResponseEntity<ErrorBody> handleLedgerUnavailable(RpcException ex) {
        log.warn("Ledger read {} failed: {}", ex.getMethod(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorBody.of(HttpStatus.SERVICE_UNAVAILABLE, LEDGER_UNAVAILABLE, ex.getMessage()));
    }
}

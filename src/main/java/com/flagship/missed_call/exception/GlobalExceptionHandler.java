package com.flagship.missed_call.exception;

import com.flagship.missed_call.auth.AdminAuthNotConfiguredException;
import com.flagship.missed_call.auth.AdminAuthenticationException;
import com.flagship.missed_call.customer.CustomerNotFoundException;
import com.flagship.missed_call.wallet.ConcurrentWalletUpdateException;
import com.flagship.missed_call.wallet.InsufficientFundsException;
import com.flagship.missed_call.wallet.WalletNotFoundException;
import com.flagship.missed_call.webhook.WebhookSignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to HTTP responses with a uniform {@link ErrorResponse} body.
 * Webhook signature failures are the exception: the provider gets a bare 403.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(WebhookSignatureException.class)
    public ResponseEntity<String> handleWebhookSignature(WebhookSignatureException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
            .contentType(MediaType.TEXT_PLAIN)
            .body("Forbidden");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", "Malformed or missing request data", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(AdminAuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAdminAuthentication(AdminAuthenticationException e) {
        log.warn("Admin authentication failed: {}", e.getMessage());
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized", e.getMessage(), null);
    }

    @ExceptionHandler(AdminAuthNotConfiguredException.class)
    public ResponseEntity<ErrorResponse> handleAdminNotConfigured(AdminAuthNotConfiguredException e) {
        log.error("Admin login rejected: {}", e.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Server Misconfigured", e.getMessage(), null);
    }

    @ExceptionHandler({WalletNotFoundException.class, CustomerNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
        log.info("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(InsufficientFundsException e) {
        log.warn("Insufficient funds: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "INSUFFICIENT_FUNDS", e.getMessage(), Map.of(
            "balance", e.getBalance().toPlainString(),
            "requested", e.getRequested().toPlainString()
        ));
    }

    @ExceptionHandler(ConcurrentWalletUpdateException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentUpdate(ConcurrentWalletUpdateException e) {
        log.warn("Wallet contention: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Concurrent Update", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                       Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}

package com.flagship.bnpl_ledger.exception;

import com.flagship.bnpl_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger exceptions to HTTP responses.
 *
 * Every failure kind of the ledger has exactly one status code and one stable error code,
 * so clients can branch on {@code code} without parsing messages.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final LedgerMetrics ledgerMetrics;

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header", "VALIDATION_ERROR",
            "Required header '" + e.getHeaderName() + "' is missing", null);
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

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "VALIDATION_ERROR",
            "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "VALIDATION_ERROR",
            "Request body or parameters could not be read", null);
    }

    @ExceptionHandler(LedgerValidationException.class)
    public ResponseEntity<ErrorResponse> handleLedgerValidation(LedgerValidationException e) {
        log.warn("Rejected input: code={}, message={}", e.getErrorCode(), e.getMessage());
        ledgerMetrics.recordRejection(e.getErrorCode());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "VALIDATION_ERROR", e.getMessage(), null);
    }

    @ExceptionHandler({InsufficientCreditException.class, InsufficientBalanceException.class,
        LimitExceedsMaxException.class})
    public ResponseEntity<ErrorResponse> handleUnprocessable(BusinessRuleException e) {
        log.warn("Business rule rejected operation: code={}, message={}", e.getErrorCode(), e.getMessage());
        ledgerMetrics.recordRejection(e.getErrorCode());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Business Rule Violation", e.getErrorCode(),
            e.getMessage(), null);
    }

    @ExceptionHandler(BusinessRuleException.class)
    public ResponseEntity<ErrorResponse> handleBusinessRule(BusinessRuleException e) {
        log.warn("Business rule rejected operation: code={}, message={}", e.getErrorCode(), e.getMessage());
        ledgerMetrics.recordRejection(e.getErrorCode());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", "INVALID_STATE", e.getMessage(), null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", "NOT_FOUND", e.getMessage(), null);
    }

    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenOperationException e) {
        log.warn("Forbidden: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Forbidden", "FORBIDDEN", e.getMessage(), null);
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConcurrencyConflictException e) {
        log.warn("Concurrency conflict: {}", e.getMessage());
        ledgerMetrics.recordRejection("BUSY");
        return respond(HttpStatus.CONFLICT, "Busy", "BUSY", e.getMessage(), null);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException e) {
        log.error("Ledger invariant violated", e);
        ledgerMetrics.recordInvariantViolation();
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
            "An unexpected error occurred", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
            "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String code,
                                                  String message, Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .code(code)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}

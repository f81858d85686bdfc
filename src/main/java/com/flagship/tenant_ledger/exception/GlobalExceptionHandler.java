package com.flagship.tenant_ledger.exception;

import com.flagship.tenant_ledger.observability.CorrelationContext;
import jakarta.validation.ConstraintViolationException;
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
 * Maps exceptions that escape the controllers to {@link ApiError} bodies.
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

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", "VALIDATION_ERROR",
                "Request validation failed", errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException e) {
        log.warn("Constraint violation: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", "VALIDATION_ERROR", e.getMessage(), null);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", "VALIDATION_ERROR",
                "Request body or parameters could not be read", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", "VALIDATION_ERROR", e.getMessage(), null);
    }

    @ExceptionHandler(InvalidWebhookSignatureException.class)
    public ResponseEntity<ApiError> handleInvalidSignature(InvalidWebhookSignatureException e) {
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized", e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler({EntryNotFoundException.class, TenantAccountNotFoundException.class,
            TransactionLogNotFoundException.class, ReconciliationReportNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(LedgerException e) {
        log.warn("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler({DuplicateReferenceException.class, DuplicateExternalTransactionException.class,
            InvalidStateTransitionException.class, ReconciliationMismatchException.class})
    public ResponseEntity<ApiError> handleConflict(LedgerException e) {
        log.warn("Conflict: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Conflict", e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler({InsufficientBalanceException.class, WithdrawalLimitExceededException.class})
    public ResponseEntity<ApiError> handleUnprocessable(LedgerException e) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable", e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiError> handleRateLimit(RateLimitExceededException e) {
        return build(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(GatewayOutcomeUnknownException.class)
    public ResponseEntity<ApiError> handleGatewayTimeout(GatewayOutcomeUnknownException e) {
        log.warn("Gateway outcome unknown: {}", e.getMessage());
        return build(HttpStatus.GATEWAY_TIMEOUT, "Gateway Timeout", e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ApiError> handleGateway(GatewayException e) {
        log.warn("Gateway failure: errorCode={}, httpStatus={}, message={}",
                e.getErrorCode(), e.getHttpStatus(), e.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Bad Gateway", e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String error, String code, String message,
                                           Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .code(code)
            .message(message)
            .details(details)
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}

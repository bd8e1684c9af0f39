package com.fintech.expensereconciliation.exception;

import com.fintech.expensereconciliation.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps reconciliation and idempotency errors to {@link ErrorResponse} bodies.
 * The error code of each exception is passed through unchanged.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidReconciliationRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(
            InvalidReconciliationRequestException ex, HttpServletRequest request) {
        log.warn("Invalid reconciliation request: {} ({})", ex.getMessage(), ex.getErrorCode());
        return build(ex, HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler(MatchItemsNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            MatchItemsNotFoundException ex, HttpServletRequest request) {
        log.warn("Match items not found: {}", ex.getMessage());
        return build(ex, HttpStatus.NOT_FOUND, request);
    }

    /**
     * Already matched items and idempotency key conflicts or in-flight duplicates.
     */
    @ExceptionHandler({
            ItemsAlreadyMatchedException.class,
            IdempotencyConflictException.class,
            IdempotencyInFlightException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(ReconciliationException ex, HttpServletRequest request) {
        log.warn("Conflict: {} ({})", ex.getMessage(), ex.getErrorCode());
        return build(ex, HttpStatus.CONFLICT, request);
    }

    @ExceptionHandler(ReconciliationRunException.class)
    public ResponseEntity<ErrorResponse> handleRunFailure(
            ReconciliationRunException ex, HttpServletRequest request) {
        log.error("Reconciliation run failed: correlationId={}", ex.getCorrelationId(), ex);
        return build(ex, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.toList());
        log.warn("Request validation failed: {}", details);

        return plain(InvalidReconciliationRequestException.VALIDATION_ERROR, "Request validation failed",
                details, HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        log.warn("Malformed request: {}", ex.getMessage());
        return plain(InvalidReconciliationRequestException.VALIDATION_ERROR, "Malformed request",
                List.of(ex.getMessage()), HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return plain("INTERNAL_ERROR", "An unexpected error occurred", null,
                HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    private ResponseEntity<ErrorResponse> build(ReconciliationException ex,
                                                HttpStatus status,
                                                HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.builder()
                .errorCode(ex.getErrorCode())
                .message(ex.getMessage())
                .status(status.value())
                .timestamp(LocalDateTime.now())
                .path(request.getRequestURI())
                .retryable(ex.isRetryable())
                .build();
        return ResponseEntity.status(status).body(error);
    }

    private ResponseEntity<ErrorResponse> plain(String errorCode,
                                                String message,
                                                List<String> details,
                                                HttpStatus status,
                                                HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.builder()
                .errorCode(errorCode)
                .message(message)
                .details(details)
                .status(status.value())
                .timestamp(LocalDateTime.now())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(status).body(error);
    }
}

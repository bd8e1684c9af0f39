package com.fintech.expensereconciliation.exception;

/**
 * Base exception for reconciliation and idempotency errors.
 * Carries a stable machine-readable code that callers can switch on.
 */
public class ReconciliationException extends RuntimeException {

    private final String errorCode;

    public ReconciliationException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ReconciliationException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Indicates if the same request may succeed when sent again unchanged.
     */
    public boolean isRetryable() {
        return false;
    }
}

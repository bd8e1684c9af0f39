package com.fintech.expensereconciliation.exception;

/**
 * Thrown for a missing or inverted date range, out-of-range matching parameters,
 * or malformed manual-match input (blank ids, blank reviewer, oversized notes).
 */
public class InvalidReconciliationRequestException extends ReconciliationException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String MISSING_DATE_RANGE = "MISSING_DATE_RANGE";

    public InvalidReconciliationRequestException(String message) {
        super(message, VALIDATION_ERROR);
    }

    public InvalidReconciliationRequestException(String message, String errorCode) {
        super(message, errorCode);
    }
}

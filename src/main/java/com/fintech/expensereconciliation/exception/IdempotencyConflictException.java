package com.fintech.expensereconciliation.exception;

/**
 * Thrown when an idempotency key is reused with a different request body.
 */
public class IdempotencyConflictException extends ReconciliationException {

    private final String idempotencyKey;

    public IdempotencyConflictException(String idempotencyKey) {
        super("Idempotency key reused with different request body", "IDEMPOTENCY_CONFLICT");
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}

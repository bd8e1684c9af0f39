package com.fintech.expensereconciliation.exception;

/**
 * Another request holding the same idempotency key is still being processed.
 * The client should retry after a short delay and will then receive the stored response.
 */
public class IdempotencyInFlightException extends ReconciliationException {

    private final String idempotencyKey;

    public IdempotencyInFlightException(String idempotencyKey) {
        super("A request with this idempotency key is already in progress", "IDEMPOTENCY_IN_FLIGHT");
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

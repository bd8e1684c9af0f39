package com.fintech.expensereconciliation.exception;

/**
 * The TTL store behind the idempotency guard could not be reached.
 * Never surfaced to API callers: the guard logs it and lets the request through.
 */
public class IdempotencyStoreException extends RuntimeException {

    public IdempotencyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

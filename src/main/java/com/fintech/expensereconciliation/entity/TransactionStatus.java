package com.fintech.expensereconciliation.entity;

/**
 * Lifecycle status of a payment transaction as recorded by the payment service.
 */
public enum TransactionStatus {
    /**
     * Initiated, not yet confirmed by the gateway.
     */
    PENDING,

    /**
     * Confirmed. Only these transactions take part in reconciliation.
     */
    SUCCESS,

    FAILED,

    /**
     * Reversed after confirmation.
     */
    REVERSED
}

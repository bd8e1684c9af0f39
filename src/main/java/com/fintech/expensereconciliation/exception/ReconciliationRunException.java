package com.fintech.expensereconciliation.exception;

/**
 * A store failure aborted a reconciliation run. The run can be repeated safely:
 * matches already written are protected by the uniqueness constraints.
 */
public class ReconciliationRunException extends ReconciliationException {

    private final String correlationId;

    public ReconciliationRunException(String message, String correlationId, Throwable cause) {
        super(message, "RECONCILIATION_ERROR", cause);
        this.correlationId = correlationId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

package com.fintech.expensereconciliation.exception;

/**
 * Thrown when a manual match names a transaction or logbook entry that does not exist.
 */
public class MatchItemsNotFoundException extends ReconciliationException {

    private final String transactionId;
    private final String logbookEntryId;

    public MatchItemsNotFoundException(String transactionId, String logbookEntryId) {
        super("Transaction or logbook entry not found", "MATCH_ITEMS_NOT_FOUND");
        this.transactionId = transactionId;
        this.logbookEntryId = logbookEntryId;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public String getLogbookEntryId() {
        return logbookEntryId;
    }
}

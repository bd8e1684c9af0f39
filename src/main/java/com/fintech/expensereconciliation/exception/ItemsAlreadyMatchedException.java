package com.fintech.expensereconciliation.exception;

/**
 * Thrown when either side of a requested match already belongs to a persisted match.
 */
public class ItemsAlreadyMatchedException extends ReconciliationException {

    public ItemsAlreadyMatchedException(String transactionId, String logbookEntryId) {
        super(String.format("Items are already matched (transaction %s, logbook entry %s)",
                transactionId, logbookEntryId), "ITEMS_ALREADY_MATCHED");
    }

    public ItemsAlreadyMatchedException(String transactionId, String logbookEntryId, Throwable cause) {
        super(String.format("Items are already matched (transaction %s, logbook entry %s)",
                transactionId, logbookEntryId), "ITEMS_ALREADY_MATCHED", cause);
    }
}

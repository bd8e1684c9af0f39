package com.fintech.expensereconciliation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Headline counts of a reconciliation run.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationSummary {

    @Column(name = "total_transactions", nullable = false)
    private int totalTransactions;

    @Column(name = "total_logbook_entries", nullable = false)
    private int totalLogbookEntries;

    @Column(name = "matched_transactions", nullable = false)
    private int matchedTransactions;

    @Column(name = "unmatched_transactions", nullable = false)
    private int unmatchedTransactions;

    @Column(name = "unmatched_logbook_entries", nullable = false)
    private int unmatchedLogbookEntries;

    /**
     * Automatic matches over total transactions, as a percentage.
     */
    @Column(name = "match_rate", nullable = false)
    private double matchRate;

    /**
     * Matches dropped because a concurrent run or reviewer claimed one of the entities first.
     */
    @Column(name = "conflicts_skipped", nullable = false)
    private int conflictsSkipped;
}

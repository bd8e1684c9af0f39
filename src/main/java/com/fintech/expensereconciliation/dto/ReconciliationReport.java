package com.fintech.expensereconciliation.dto;

import com.fintech.expensereconciliation.entity.ReconciliationMatch;
import com.fintech.expensereconciliation.entity.ReconciliationSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one reconciliation run.
 * Used for the API response, audit trail and manual review queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationReport {

    private String id;
    private LocalDate reportDate;
    private DateRange dateRange;
    private ReconciliationSummary summary;

    @Builder.Default
    private List<ReconciliationMatch> matches = new ArrayList<>();

    @Builder.Default
    private List<UnmatchedTransaction> unmatchedTransactions = new ArrayList<>();

    @Builder.Default
    private List<UnmatchedLogbookEntry> unmatchedLogbookEntries = new ArrayList<>();

    private LocalDateTime generatedAt;
    private String generatedBy;
    private String correlationId;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DateRange {
        private LocalDateTime startDate;
        private LocalDateTime endDate;
    }
}

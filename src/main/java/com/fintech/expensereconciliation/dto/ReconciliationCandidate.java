package com.fintech.expensereconciliation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A scored pairing of one transaction and one logbook entry considered during a run.
 * Never persisted on its own; it only appears as a "possible match" inside reports.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationCandidate {

    private String transactionId;
    private String logbookEntryId;
    private String userId;
    private long transactionAmount;
    private long logbookAmount;
    private String currency;
    private LocalDateTime transactionDate;
    private LocalDateTime logbookDate;
    private double matchScore;
    private double timeDifferenceMinutes;
    private long amountDifferenceMinor;
    private List<String> reasons;
}

package com.fintech.expensereconciliation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A transaction left unmatched by a run, with the best candidates for manual review.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnmatchedTransaction {

    private String id;
    private String userId;
    private long amountMinor;
    private String currency;
    private String reference;
    private String status;
    private LocalDateTime createdAt;

    @Builder.Default
    private List<ReconciliationCandidate> possibleMatches = new ArrayList<>();
}

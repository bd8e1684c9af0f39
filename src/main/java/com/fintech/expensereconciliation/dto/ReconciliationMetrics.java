package com.fintech.expensereconciliation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregates over the matches created in a period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationMetrics {

    /**
     * Matches over successful transactions created in the period, as a percentage.
     */
    private double matchRate;
    private double averageMatchScore;
    private double averageTimeDifference;
    private long totalMatches;
    private long automaticMatches;
    private long manualMatches;
}

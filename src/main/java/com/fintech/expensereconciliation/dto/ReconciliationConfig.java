package com.fintech.expensereconciliation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Matching parameters for a run.
 * <p>
 * Callers send only the fields they want to override; {@link #mergeOnto(ReconciliationConfig)}
 * fills the rest from the service defaults.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationConfig {

    /**
     * Maximum distance between transaction and entry timestamps.
     */
    private Integer timeWindowMinutes;

    /**
     * Allowed amount difference as a percentage of the transaction amount. 0 means exact.
     */
    private Double amountTolerancePercent;

    /**
     * Candidates scoring below this are discarded.
     */
    private Double minimumMatchScore;

    /**
     * Candidates scoring at least this are matched without review.
     */
    private Double autoMatchThreshold;

    public ReconciliationConfig mergeOnto(ReconciliationConfig defaults) {
        return ReconciliationConfig.builder()
                .timeWindowMinutes(timeWindowMinutes != null ? timeWindowMinutes : defaults.getTimeWindowMinutes())
                .amountTolerancePercent(amountTolerancePercent != null
                        ? amountTolerancePercent : defaults.getAmountTolerancePercent())
                .minimumMatchScore(minimumMatchScore != null ? minimumMatchScore : defaults.getMinimumMatchScore())
                .autoMatchThreshold(autoMatchThreshold != null ? autoMatchThreshold : defaults.getAutoMatchThreshold())
                .build();
    }
}

package com.fintech.expensereconciliation.service;

import com.fintech.expensereconciliation.dto.ReconciliationConfig;
import com.fintech.expensereconciliation.entity.LogbookEntry;
import com.fintech.expensereconciliation.entity.Transaction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Computes how likely a transaction and a logbook entry describe the same payment.
 * <p>
 * score = amountWeight * amount + timeWeight * time + userWeight * user + currencyWeight * currency
 * <p>
 * Note: {@link CandidateGenerator} only pairs records of the same user and currency, so every
 * candidate it produces collects the full user and currency weight (0.3 with the defaults) and
 * only the amount and time factors discriminate. The two factors are kept so the weights still
 * mean something if that filter is ever relaxed.
 */
@Component
public class ScoringEngine {

    @Value("${reconciliation.scoring.amount-weight:0.4}")
    private double amountWeight = 0.4;

    @Value("${reconciliation.scoring.time-weight:0.3}")
    private double timeWeight = 0.3;

    @Value("${reconciliation.scoring.user-weight:0.2}")
    private double userWeight = 0.2;

    @Value("${reconciliation.scoring.currency-weight:0.1}")
    private double currencyWeight = 0.1;

    /**
     * Scores a pair, clamped to [0, 1].
     *
     * @param timeDifferenceMinutes absolute distance between the two timestamps
     * @param amountDifferenceMinor absolute amount difference in minor units
     */
    public double calculateMatchScore(Transaction transaction,
                                      LogbookEntry entry,
                                      double timeDifferenceMinutes,
                                      long amountDifferenceMinor,
                                      ReconciliationConfig config) {
        double score = amountWeight * amountComponent(transaction.getAmountMinor(), amountDifferenceMinor, config)
                + timeWeight * timeComponent(timeDifferenceMinutes, config)
                + userWeight * (transaction.getUserId().equals(entry.getUserId()) ? 1.0 : 0.0)
                + currencyWeight * (transaction.getCurrency().equals(entry.getCurrency()) ? 1.0 : 0.0);

        return Math.min(1.0, Math.max(0.0, score));
    }

    /**
     * Whether a candidate is worth keeping for resolution and review.
     */
    public boolean meetsMinimum(double score, ReconciliationConfig config) {
        return score >= config.getMinimumMatchScore();
    }

    double amountComponent(long transactionAmount, long amountDifferenceMinor, ReconciliationConfig config) {
        if (amountDifferenceMinor == 0) {
            return 1.0;
        }
        double tolerance = CandidateGenerator.amountTolerance(transactionAmount, config);
        if (tolerance <= 0) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - (amountDifferenceMinor / tolerance));
    }

    double timeComponent(double timeDifferenceMinutes, ReconciliationConfig config) {
        return Math.max(0.0, 1.0 - (timeDifferenceMinutes / config.getTimeWindowMinutes()));
    }
}

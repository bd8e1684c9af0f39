package com.fintech.expensereconciliation.service;

import com.fintech.expensereconciliation.dto.ReconciliationCandidate;
import com.fintech.expensereconciliation.dto.ReconciliationConfig;
import com.fintech.expensereconciliation.entity.LogbookEntry;
import com.fintech.expensereconciliation.entity.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pairs transactions with logbook entries that could describe the same payment.
 * <p>
 * A pair survives when user and currency are equal, the timestamps are within the time window
 * and the amounts are within the tolerance. Survivors are scored and those under the minimum
 * score are dropped. The working set is bounded by the run's date range, so the nested loop
 * per (user, currency) bucket is cheap enough without indexing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CandidateGenerator {

    private static final long MINOR_UNITS_PER_MAJOR = 100;

    private final ScoringEngine scoringEngine;

    public List<ReconciliationCandidate> generateCandidates(List<Transaction> transactions,
                                                            List<LogbookEntry> entries,
                                                            ReconciliationConfig config) {
        Map<String, List<LogbookEntry>> entriesByBucket = entries.stream()
                .collect(Collectors.groupingBy(e -> bucket(e.getUserId(), e.getCurrency())));

        List<ReconciliationCandidate> candidates = new ArrayList<>();
        int pairsInWindow = 0;

        for (Transaction transaction : transactions) {
            List<LogbookEntry> bucket = entriesByBucket.getOrDefault(
                    bucket(transaction.getUserId(), transaction.getCurrency()), Collections.emptyList());

            for (LogbookEntry entry : bucket) {
                double timeDiff = minutesBetween(transaction.getCreatedAt(), entry.getCreatedAt());
                if (timeDiff > config.getTimeWindowMinutes()) {
                    continue;
                }

                long amountDiff = Math.abs(transaction.getAmountMinor() - entry.getAmountMinor());
                if (amountDiff > amountTolerance(transaction.getAmountMinor(), config)) {
                    continue;
                }
                pairsInWindow++;

                double score = scoringEngine.calculateMatchScore(transaction, entry, timeDiff, amountDiff, config);
                if (!scoringEngine.meetsMinimum(score, config)) {
                    continue;
                }

                candidates.add(ReconciliationCandidate.builder()
                        .transactionId(transaction.getId())
                        .logbookEntryId(entry.getId())
                        .userId(transaction.getUserId())
                        .transactionAmount(transaction.getAmountMinor())
                        .logbookAmount(entry.getAmountMinor())
                        .currency(transaction.getCurrency())
                        .transactionDate(transaction.getCreatedAt())
                        .logbookDate(entry.getCreatedAt())
                        .matchScore(score)
                        .timeDifferenceMinutes(timeDiff)
                        .amountDifferenceMinor(amountDiff)
                        .reasons(describe(transaction, entry, timeDiff, amountDiff))
                        .build());
            }
        }

        log.debug("Generated {} candidates from {} pairs within constraints ({} transactions x {} entries)",
                candidates.size(), pairsInWindow, transactions.size(), entries.size());
        return candidates;
    }

    /**
     * Absolute distance between two timestamps in fractional minutes.
     */
    public static double minutesBetween(LocalDateTime first, LocalDateTime second) {
        return Duration.between(first, second).abs().toMillis() / 60_000.0;
    }

    /**
     * Largest amount difference, in minor units, still accepted for a transaction amount.
     */
    static double amountTolerance(long transactionAmount, ReconciliationConfig config) {
        return Math.abs(transactionAmount) * config.getAmountTolerancePercent() / 100.0;
    }

    private List<String> describe(Transaction transaction, LogbookEntry entry, double timeDiff, long amountDiff) {
        List<String> reasons = new ArrayList<>();

        if (amountDiff == 0) {
            reasons.add("Exact amount match");
        } else if (amountDiff < MINOR_UNITS_PER_MAJOR) {
            reasons.add("Close amount match");
        }

        if (timeDiff < 1) {
            reasons.add("Same minute");
        } else if (timeDiff < 5) {
            reasons.add("Within 5 minutes");
        } else {
            reasons.add(String.format("Within %d minutes", Math.round(timeDiff)));
        }

        if (transaction.getUserId().equals(entry.getUserId())) {
            reasons.add("Same user");
        }
        if (transaction.getCurrency().equals(entry.getCurrency())) {
            reasons.add("Same currency");
        }
        return reasons;
    }

    private static String bucket(String userId, String currency) {
        return userId + '|' + currency;
    }
}

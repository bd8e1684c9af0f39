package com.fintech.expensereconciliation.service;

import com.fintech.expensereconciliation.dto.ReconciliationCandidate;
import com.fintech.expensereconciliation.dto.ReconciliationConfig;
import com.fintech.expensereconciliation.dto.UnmatchedLogbookEntry;
import com.fintech.expensereconciliation.dto.UnmatchedTransaction;
import com.fintech.expensereconciliation.entity.LogbookEntry;
import com.fintech.expensereconciliation.entity.MatchCriteria;
import com.fintech.expensereconciliation.entity.MatchType;
import com.fintech.expensereconciliation.entity.ReconciliationMatch;
import com.fintech.expensereconciliation.entity.Transaction;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns scored candidates into mutually exclusive automatic matches.
 * <p>
 * Candidates are walked best first; a candidate becomes a match only if it reaches the
 * auto-match threshold and neither its transaction nor its entry has been claimed by a better
 * candidate. The ordering is total, so the same input always yields the same matches.
 */
@Component
@Slf4j
public class MatchResolver {

    public static final int MAX_POSSIBLE_MATCHES = 5;

    static final Comparator<ReconciliationCandidate> RESOLUTION_ORDER =
            Comparator.comparingDouble(ReconciliationCandidate::getMatchScore).reversed()
                    .thenComparingDouble(ReconciliationCandidate::getTimeDifferenceMinutes)
                    .thenComparing(ReconciliationCandidate::getTransactionId)
                    .thenComparing(ReconciliationCandidate::getLogbookEntryId);

    /**
     * Greedy claim pass. Matches are returned unpersisted, in resolution order.
     */
    public Resolution resolve(List<ReconciliationCandidate> candidates,
                              ReconciliationConfig config,
                              String correlationId) {
        ClaimArena arena = new ClaimArena();
        List<ReconciliationMatch> matches = new ArrayList<>();
        int belowThreshold = 0;
        int alreadyClaimed = 0;

        for (ReconciliationCandidate candidate : sorted(candidates)) {
            if (candidate.getMatchScore() < config.getAutoMatchThreshold()) {
                belowThreshold++;
                continue;
            }
            if (!arena.isUnclaimed(candidate)) {
                alreadyClaimed++;
                continue;
            }

            ReconciliationMatch match = toAutomaticMatch(candidate, config, correlationId);
            arena.claim(candidate, match.getId());
            matches.add(match);
        }

        log.debug("Resolved {} automatic matches from {} candidates ({} below threshold, {} lost to better candidates), " +
                "correlationId={}", matches.size(), candidates.size(), belowThreshold, alreadyClaimed, correlationId);

        return new Resolution(arena, matches);
    }

    public List<UnmatchedTransaction> collectUnmatchedTransactions(List<Transaction> transactions,
                                                                   List<ReconciliationCandidate> candidates,
                                                                   ClaimArena arena) {
        return transactions.stream()
                .filter(t -> !arena.isTransactionClaimed(t.getId()))
                .map(t -> UnmatchedTransaction.builder()
                        .id(t.getId())
                        .userId(t.getUserId())
                        .amountMinor(t.getAmountMinor())
                        .currency(t.getCurrency())
                        .reference(t.getReference())
                        .status(t.getStatus().name())
                        .createdAt(t.getCreatedAt())
                        .possibleMatches(candidates.stream()
                                .filter(c -> c.getTransactionId().equals(t.getId()))
                                .filter(c -> !arena.isEntryClaimed(c.getLogbookEntryId()))
                                .sorted(RESOLUTION_ORDER)
                                .limit(MAX_POSSIBLE_MATCHES)
                                .collect(Collectors.toList()))
                        .build())
                .collect(Collectors.toList());
    }

    public List<UnmatchedLogbookEntry> collectUnmatchedLogbookEntries(List<LogbookEntry> entries,
                                                                      List<ReconciliationCandidate> candidates,
                                                                      ClaimArena arena) {
        return entries.stream()
                .filter(e -> !arena.isEntryClaimed(e.getId()))
                .map(e -> UnmatchedLogbookEntry.builder()
                        .id(e.getId())
                        .userId(e.getUserId())
                        .type(e.getType())
                        .amountMinor(e.getAmountMinor())
                        .currency(e.getCurrency())
                        .note(e.getNote())
                        .createdAt(e.getCreatedAt())
                        .possibleMatches(candidates.stream()
                                .filter(c -> c.getLogbookEntryId().equals(e.getId()))
                                .filter(c -> !arena.isTransactionClaimed(c.getTransactionId()))
                                .sorted(RESOLUTION_ORDER)
                                .limit(MAX_POSSIBLE_MATCHES)
                                .collect(Collectors.toList()))
                        .build())
                .collect(Collectors.toList());
    }

    private List<ReconciliationCandidate> sorted(List<ReconciliationCandidate> candidates) {
        List<ReconciliationCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(RESOLUTION_ORDER);
        return ordered;
    }

    private ReconciliationMatch toAutomaticMatch(ReconciliationCandidate candidate,
                                                 ReconciliationConfig config,
                                                 String correlationId) {
        return ReconciliationMatch.builder()
                .id(UUID.randomUUID().toString())
                .logbookEntryId(candidate.getLogbookEntryId())
                .transactionId(candidate.getTransactionId())
                .userId(candidate.getUserId())
                .matchScore(candidate.getMatchScore())
                .matchType(MatchType.AUTOMATIC)
                .matchCriteria(MatchCriteria.builder()
                        .amountMatch(candidate.getAmountDifferenceMinor() == 0)
                        .timeMatch(candidate.getTimeDifferenceMinutes() <= config.getTimeWindowMinutes())
                        // candidates never cross users or currencies
                        .currencyMatch(true)
                        .userMatch(true)
                        .build())
                .timeDifferenceMinutes(candidate.getTimeDifferenceMinutes())
                .amountDifferenceMinor(candidate.getAmountDifferenceMinor())
                .matchedAt(LocalDateTime.now())
                .correlationId(correlationId)
                .build();
    }

    /**
     * Matches chosen by one pass together with the claims that back them.
     */
    @Getter
    @RequiredArgsConstructor
    public static class Resolution {
        private final ClaimArena arena;
        private final List<ReconciliationMatch> matches;
    }
}

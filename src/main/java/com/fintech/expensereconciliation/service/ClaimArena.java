package com.fintech.expensereconciliation.service;

import com.fintech.expensereconciliation.dto.ReconciliationCandidate;
import com.fintech.expensereconciliation.entity.ReconciliationMatch;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Claim state of every transaction and logbook entry during one resolution pass.
 * <p>
 * An id with no entry is Unclaimed; an id mapped to a match id is Claimed by that match.
 * Claims are only taken by {@link MatchResolver} and only given back when persisting a
 * match loses to a concurrent writer.
 */
public class ClaimArena {

    private final Map<String, String> transactionClaims = new HashMap<>();
    private final Map<String, String> entryClaims = new HashMap<>();

    public boolean isUnclaimed(ReconciliationCandidate candidate) {
        return !transactionClaims.containsKey(candidate.getTransactionId())
                && !entryClaims.containsKey(candidate.getLogbookEntryId());
    }

    public void claim(ReconciliationCandidate candidate, String matchId) {
        if (!isUnclaimed(candidate)) {
            throw new IllegalStateException("Candidate " + candidate.getTransactionId() + "/"
                    + candidate.getLogbookEntryId() + " is already claimed");
        }
        transactionClaims.put(candidate.getTransactionId(), matchId);
        entryClaims.put(candidate.getLogbookEntryId(), matchId);
    }

    public void release(ReconciliationMatch match) {
        transactionClaims.remove(match.getTransactionId(), match.getId());
        entryClaims.remove(match.getLogbookEntryId(), match.getId());
    }

    public boolean isTransactionClaimed(String transactionId) {
        return transactionClaims.containsKey(transactionId);
    }

    public boolean isEntryClaimed(String logbookEntryId) {
        return entryClaims.containsKey(logbookEntryId);
    }

    public Optional<String> entryClaim(String logbookEntryId) {
        return Optional.ofNullable(entryClaims.get(logbookEntryId));
    }
}

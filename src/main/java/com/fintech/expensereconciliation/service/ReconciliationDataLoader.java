package com.fintech.expensereconciliation.service;

import com.fintech.expensereconciliation.entity.LogbookEntry;
import com.fintech.expensereconciliation.entity.Transaction;
import com.fintech.expensereconciliation.entity.TransactionStatus;
import com.fintech.expensereconciliation.repository.LogbookEntryRepository;
import com.fintech.expensereconciliation.repository.ReconciliationMatchRepository;
import com.fintech.expensereconciliation.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fetches the working set of a reconciliation run.
 * <p>
 * Entities that already belong to a persisted match are left out, so a re-run over the same
 * range never proposes them again. Transient database errors are retried before the run gives up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationDataLoader {

    private final TransactionRepository transactionRepository;
    private final LogbookEntryRepository logbookEntryRepository;
    private final ReconciliationMatchRepository matchRepository;

    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2)
    )
    public List<Transaction> loadTransactions(LocalDateTime start, LocalDateTime end, String userId) {
        List<Transaction> transactions = transactionRepository.findForReconciliation(
                TransactionStatus.SUCCESS, start, end, userId);
        if (transactions.isEmpty()) {
            return transactions;
        }

        Set<String> matched = new HashSet<>(matchRepository.findMatchedTransactionIds(
                transactions.stream().map(Transaction::getId).collect(Collectors.toList())));
        if (!matched.isEmpty()) {
            log.debug("Skipping {} transactions that are already matched", matched.size());
        }
        return transactions.stream()
                .filter(t -> !matched.contains(t.getId()))
                .collect(Collectors.toList());
    }

    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2)
    )
    public List<LogbookEntry> loadUnreconciledEntries(LocalDateTime start, LocalDateTime end, String userId) {
        List<LogbookEntry> entries = logbookEntryRepository.findUnreconciled(start, end, userId);
        if (entries.isEmpty()) {
            return entries;
        }

        Set<String> matched = new HashSet<>(matchRepository.findMatchedLogbookEntryIds(
                entries.stream().map(LogbookEntry::getId).collect(Collectors.toList())));
        if (!matched.isEmpty()) {
            log.warn("{} logbook entries have a match but are not flagged reconciled; skipping them",
                    matched.size());
        }
        return entries.stream()
                .filter(e -> !matched.contains(e.getId()))
                .collect(Collectors.toList());
    }
}

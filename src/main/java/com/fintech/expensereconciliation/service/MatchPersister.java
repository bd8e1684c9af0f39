package com.fintech.expensereconciliation.service;

import com.fintech.expensereconciliation.entity.ReconciliationMatch;
import com.fintech.expensereconciliation.exception.ItemsAlreadyMatchedException;
import com.fintech.expensereconciliation.repository.LogbookEntryRepository;
import com.fintech.expensereconciliation.repository.ReconciliationMatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes one automatic match and links its logbook entry, in a transaction of its own,
 * so a match lost to a concurrent run rolls back alone without undoing the rest of the run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MatchPersister {

    private final ReconciliationMatchRepository matchRepository;
    private final LogbookEntryRepository logbookEntryRepository;

    /**
     * @throws DataIntegrityViolationException if either entity already has a match row
     * @throws ItemsAlreadyMatchedException    if the entry was marked reconciled meanwhile
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ReconciliationMatch persist(ReconciliationMatch match) {
        ReconciliationMatch saved = matchRepository.saveAndFlush(match);

        int updated = logbookEntryRepository.markReconciled(match.getLogbookEntryId(), match.getTransactionId());
        if (updated == 0) {
            log.debug("Logbook entry {} was reconciled concurrently, rolling back match {}",
                    match.getLogbookEntryId(), match.getId());
            throw new ItemsAlreadyMatchedException(match.getTransactionId(), match.getLogbookEntryId());
        }
        return saved;
    }
}

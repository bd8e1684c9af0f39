package com.fintech.expensereconciliation.scheduler;

import com.fintech.expensereconciliation.dto.ReconciliationReport;
import com.fintech.expensereconciliation.entity.ReconciliationSummary;
import com.fintech.expensereconciliation.exception.ReconciliationException;
import com.fintech.expensereconciliation.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Scheduler for automated reconciliation runs.
 * <p>
 * Each run covers the last {@code reconciliation.scheduler.lookback-hours} hours for all
 * users. Consecutive windows overlap; items matched by an earlier run are skipped.
 * <p>
 * Default: every 15 minutes over the last 24 hours
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationScheduler {

    private final ReconciliationService reconciliationService;

    @Value("${reconciliation.scheduler.enabled:true}")
    private boolean schedulerEnabled;

    @Value("${reconciliation.scheduler.lookback-hours:24}")
    private long lookbackHours;

    /**
     * Uses fixedDelay so the next run doesn't start until the previous one completes.
     */
    @Scheduled(fixedDelayString = "${reconciliation.scheduler.interval-ms:900000}",
            initialDelayString = "${reconciliation.scheduler.initial-delay-ms:60000}")
    public void runScheduledReconciliation() {
        if (!schedulerEnabled) {
            log.debug("Scheduler is disabled, skipping reconciliation run");
            return;
        }

        LocalDateTime endDate = LocalDateTime.now();
        LocalDateTime startDate = endDate.minusHours(lookbackHours);
        log.info("Starting scheduled reconciliation for {} to {}", startDate, endDate);

        try {
            ReconciliationReport report = reconciliationService.runReconciliation(startDate, endDate, null, null);
            logResult(report);
        } catch (ReconciliationException e) {
            log.warn("Scheduled reconciliation failed: {} ({})", e.getMessage(), e.getErrorCode());
        } catch (Exception e) {
            log.error("Scheduled reconciliation failed with unexpected error", e);
        }
    }

    private void logResult(ReconciliationReport report) {
        ReconciliationSummary summary = report.getSummary();
        if (summary.getTotalTransactions() == 0 && summary.getTotalLogbookEntries() == 0) {
            log.info("Nothing to reconcile");
            return;
        }
        log.info("Scheduled reconciliation {} completed: {} matched, {} unmatched transactions, " +
                        "{} unmatched logbook entries, {} conflicts",
                report.getId(),
                summary.getMatchedTransactions(),
                summary.getUnmatchedTransactions(),
                summary.getUnmatchedLogbookEntries(),
                summary.getConflictsSkipped());
    }
}

package com.fintech.expensereconciliation.integration;

import com.fintech.expensereconciliation.dto.ManualMatchRequest;
import com.fintech.expensereconciliation.dto.ReconciliationMetrics;
import com.fintech.expensereconciliation.dto.ReconciliationReport;
import com.fintech.expensereconciliation.entity.LogbookEntry;
import com.fintech.expensereconciliation.entity.MatchCriteria;
import com.fintech.expensereconciliation.entity.MatchType;
import com.fintech.expensereconciliation.entity.ReconciliationMatch;
import com.fintech.expensereconciliation.entity.Transaction;
import com.fintech.expensereconciliation.entity.TransactionStatus;
import com.fintech.expensereconciliation.exception.ItemsAlreadyMatchedException;
import com.fintech.expensereconciliation.repository.LogbookEntryRepository;
import com.fintech.expensereconciliation.repository.ReconciliationMatchRepository;
import com.fintech.expensereconciliation.repository.ReconciliationReportRepository;
import com.fintech.expensereconciliation.repository.TransactionRepository;
import com.fintech.expensereconciliation.service.ReconciliationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the reconciliation service.
 *
 * These tests verify the full reconciliation flow with a real database
 * (H2 in-memory), including the uniqueness constraints on matches.
 */
@SpringBootTest
@ActiveProfiles("test")
class ReconciliationIntegrationTest {

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private LogbookEntryRepository logbookEntryRepository;

    @Autowired
    private ReconciliationMatchRepository matchRepository;

    @Autowired
    private ReconciliationReportRepository reportRepository;

    private LocalDateTime base;
    private LocalDateTime start;
    private LocalDateTime end;

    @BeforeEach
    void setUp() {
        // Clear existing data
        matchRepository.deleteAll();
        reportRepository.deleteAll();
        logbookEntryRepository.deleteAll();
        transactionRepository.deleteAll();

        base = LocalDateTime.now().minusHours(3).truncatedTo(ChronoUnit.SECONDS);
        start = base.minusHours(1);
        end = base.plusHours(1);
    }

    @Test
    @DisplayName("Full reconciliation flow - matches, links and stores the report")
    void fullReconciliationFlow() {
        // Given
        transactionRepository.save(transaction("tx-match", "user-1", 2_500, "USD", base));
        transactionRepository.save(transaction("tx-lonely", "user-1", 9_999, "USD", base));
        transactionRepository.save(failedTransaction("tx-failed", "user-1", 2_500, "USD", base));
        logbookEntryRepository.save(entry("e-match", "user-1", 2_500, "USD", base.plusSeconds(30)));
        logbookEntryRepository.save(entry("e-euro", "user-1", 1_234, "EUR", base));

        // When
        ReconciliationReport report = reconciliationService.runReconciliation(start, end, null, null);

        // Then
        assertThat(report.getSummary().getTotalTransactions()).isEqualTo(2);
        assertThat(report.getSummary().getTotalLogbookEntries()).isEqualTo(2);
        assertThat(report.getSummary().getMatchedTransactions()).isEqualTo(1);
        assertThat(report.getSummary().getMatchRate()).isEqualTo(50.0);
        assertThat(report.getUnmatchedTransactions()).extracting("id").containsExactly("tx-lonely");
        assertThat(report.getUnmatchedLogbookEntries()).extracting("id").containsExactly("e-euro");

        LogbookEntry linked = logbookEntryRepository.findById("e-match").orElseThrow();
        assertThat(linked.isReconciled()).isTrue();
        assertThat(linked.getReconciledTransactionId()).isEqualTo("tx-match");

        ReconciliationReport stored = reconciliationService.getReconciliationReport(report.getId()).orElseThrow();
        assertThat(stored.getMatches()).extracting(ReconciliationMatch::getTransactionId).containsExactly("tx-match");
        assertThat(stored.getSummary().getMatchRate()).isEqualTo(50.0);
        assertThat(stored.getSummary().getUnmatchedTransactions()).isEqualTo(1);
        assertThat(stored.getSummary().getUnmatchedLogbookEntries()).isEqualTo(1);
        assertThat(stored.getUnmatchedTransactions()).extracting("id").containsExactly("tx-lonely");
        assertThat(stored.getUnmatchedLogbookEntries()).extracting("id").containsExactly("e-euro");
        assertThat(stored.getCorrelationId()).isEqualTo(report.getCorrelationId());
    }

    @Test
    @DisplayName("A fifteen minute gap is never matched under default settings")
    void fifteenMinuteGapStaysUnmatched() {
        transactionRepository.save(transaction("tx-1", "user-1", 2_500, "USD", base));
        logbookEntryRepository.save(entry("e-1", "user-1", 2_500, "USD", base.plusMinutes(15)));

        ReconciliationReport report = reconciliationService.runReconciliation(start, end, null, null);

        assertThat(report.getMatches()).isEmpty();
        assertThat(report.getUnmatchedTransactions()).hasSize(1);
        assertThat(report.getUnmatchedTransactions().get(0).getPossibleMatches()).isEmpty();
        assertThat(report.getUnmatchedLogbookEntries()).hasSize(1);
    }

    @Test
    @DisplayName("Re-running over the same range does not match anything twice")
    void rerunIsIdempotent() {
        transactionRepository.save(transaction("tx-1", "user-1", 2_500, "USD", base));
        logbookEntryRepository.save(entry("e-1", "user-1", 2_500, "USD", base));

        ReconciliationReport first = reconciliationService.runReconciliation(start, end, null, null);
        ReconciliationReport second = reconciliationService.runReconciliation(start, end, null, null);

        assertThat(first.getSummary().getMatchedTransactions()).isEqualTo(1);
        assertThat(second.getSummary().getTotalTransactions()).isZero();
        assertThat(second.getSummary().getMatchedTransactions()).isZero();
        assertThat(matchRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Overlapping runs persist each match exactly once")
    void concurrentRunsDoNotDoubleMatch() throws Exception {
        // Given
        for (int i = 0; i < 10; i++) {
            transactionRepository.save(transaction("tx-" + i, "user-" + i, 1_000 + i, "USD", base));
            logbookEntryRepository.save(entry("e-" + i, "user-" + i, 1_000 + i, "USD", base.plusSeconds(5)));
        }
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        Callable<ReconciliationReport> run = () -> {
            go.await();
            return reconciliationService.runReconciliation(start, end, null, null);
        };

        try {
            Future<ReconciliationReport> a = executor.submit(run);
            Future<ReconciliationReport> b = executor.submit(run);

            // When
            go.countDown();
            ReconciliationReport reportA = a.get(30, TimeUnit.SECONDS);
            ReconciliationReport reportB = b.get(30, TimeUnit.SECONDS);

            // Then
            assertThat(matchRepository.count()).isEqualTo(10);
            assertThat(reportA.getSummary().getMatchedTransactions() + reportB.getSummary().getMatchedTransactions())
                    .isEqualTo(10);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("The database refuses a second match for the same transaction")
    void uniqueConstraintOnTransaction() {
        matchRepository.saveAndFlush(match("tx-1", "e-1"));

        assertThatThrownBy(() -> matchRepository.saveAndFlush(match("tx-1", "e-2")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Manual match links the leftovers and refuses a second match")
    void manualMatchFlow() {
        // Given
        transactionRepository.save(transaction("tx-1", "user-1", 2_500, "USD", base));
        logbookEntryRepository.save(entry("e-1", "user-1", 2_400, "USD", base.plusMinutes(45)));
        logbookEntryRepository.save(entry("e-2", "user-1", 2_500, "USD", base.plusMinutes(50)));

        // When
        ReconciliationMatch match = reconciliationService.createManualMatch(ManualMatchRequest.builder()
                .transactionId("tx-1")
                .logbookEntryId("e-1")
                .notes("Tip not logged")
                .build(), "reviewer-9");

        // Then
        assertThat(match.getMatchType()).isEqualTo(MatchType.MANUAL);
        assertThat(logbookEntryRepository.findById("e-1").orElseThrow().isReconciled()).isTrue();

        assertThatThrownBy(() -> reconciliationService.createManualMatch(ManualMatchRequest.builder()
                .transactionId("tx-1")
                .logbookEntryId("e-2")
                .build(), "reviewer-9"))
                .isInstanceOf(ItemsAlreadyMatchedException.class);
        assertThat(logbookEntryRepository.findById("e-2").orElseThrow().isReconciled()).isFalse();
    }

    @Test
    @DisplayName("Metrics split automatic and manual matches")
    void metricsAfterRunAndManualMatch() {
        transactionRepository.save(transaction("tx-auto", "user-1", 2_500, "USD", base));
        transactionRepository.save(transaction("tx-manual", "user-1", 7_000, "USD", base));
        logbookEntryRepository.save(entry("e-auto", "user-1", 2_500, "USD", base));
        logbookEntryRepository.save(entry("e-manual", "user-1", 6_900, "USD", base.plusMinutes(30)));

        reconciliationService.runReconciliation(start, end, null, null);
        reconciliationService.createManualMatch(ManualMatchRequest.builder()
                .transactionId("tx-manual")
                .logbookEntryId("e-manual")
                .build(), "reviewer-9");

        // Matches are stamped with the current time, the transactions three hours earlier
        ReconciliationMetrics metrics = reconciliationService.getReconciliationMetrics(
                start, LocalDateTime.now().plusMinutes(1), null);

        assertThat(metrics.getTotalMatches()).isEqualTo(2);
        assertThat(metrics.getAutomaticMatches()).isEqualTo(1);
        assertThat(metrics.getManualMatches()).isEqualTo(1);
        assertThat(metrics.getMatchRate()).isEqualTo(100.0);
    }

    private Transaction transaction(String id, String userId, long amount, String currency, LocalDateTime at) {
        return Transaction.builder()
                .id(id)
                .userId(userId)
                .amountMinor(amount)
                .currency(currency)
                .reference("ref-" + id)
                .status(TransactionStatus.SUCCESS)
                .createdAt(at)
                .build();
    }

    private Transaction failedTransaction(String id, String userId, long amount, String currency, LocalDateTime at) {
        Transaction transaction = transaction(id, userId, amount, currency, at);
        transaction.setStatus(TransactionStatus.FAILED);
        return transaction;
    }

    private LogbookEntry entry(String id, String userId, long amount, String currency, LocalDateTime at) {
        return LogbookEntry.builder()
                .id(id)
                .userId(userId)
                .type("expense")
                .amountMinor(amount)
                .currency(currency)
                .createdAt(at)
                .build();
    }

    private ReconciliationMatch match(String transactionId, String entryId) {
        return ReconciliationMatch.builder()
                .id(UUID.randomUUID().toString())
                .transactionId(transactionId)
                .logbookEntryId(entryId)
                .userId("user-1")
                .matchScore(1.0)
                .matchType(MatchType.AUTOMATIC)
                .matchCriteria(MatchCriteria.builder()
                        .amountMatch(true)
                        .timeMatch(true)
                        .currencyMatch(true)
                        .userMatch(true)
                        .build())
                .matchedAt(LocalDateTime.now())
                .build();
    }
}

package com.fintech.expensereconciliation.service;

import com.fintech.expensereconciliation.dto.ManualMatchRequest;
import com.fintech.expensereconciliation.dto.ReconciliationCandidate;
import com.fintech.expensereconciliation.dto.ReconciliationConfig;
import com.fintech.expensereconciliation.dto.ReconciliationMetrics;
import com.fintech.expensereconciliation.dto.ReconciliationReport;
import com.fintech.expensereconciliation.dto.UnmatchedLogbookEntry;
import com.fintech.expensereconciliation.dto.UnmatchedTransaction;
import com.fintech.expensereconciliation.entity.LogbookEntry;
import com.fintech.expensereconciliation.entity.MatchCriteria;
import com.fintech.expensereconciliation.entity.MatchType;
import com.fintech.expensereconciliation.entity.ReconciliationMatch;
import com.fintech.expensereconciliation.entity.Transaction;
import com.fintech.expensereconciliation.entity.TransactionStatus;
import com.fintech.expensereconciliation.exception.InvalidReconciliationRequestException;
import com.fintech.expensereconciliation.exception.ItemsAlreadyMatchedException;
import com.fintech.expensereconciliation.exception.MatchItemsNotFoundException;
import com.fintech.expensereconciliation.exception.ReconciliationRunException;
import com.fintech.expensereconciliation.repository.LogbookEntryRepository;
import com.fintech.expensereconciliation.repository.ReconciliationMatchRepository;
import com.fintech.expensereconciliation.repository.TransactionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Matches successful payment transactions against logbook expense entries.
 * <p>
 * Key Design Decisions:
 * 1. Exclusivity: a greedy claim pass keeps a run from matching an entity twice, and unique
 *    constraints on the matches table keep overlapping runs from doing so
 * 2. Re-runnable: a failed run can be repeated, already persisted matches are skipped
 * 3. Traceability: every run carries a correlation id through its logs, matches and report
 * 4. Observability: emits metrics for monitoring reconciliation health
 */
@Service
@Slf4j
public class ReconciliationService {

    static final String SYSTEM_USER = "system";

    private final ReconciliationDataLoader dataLoader;
    private final CandidateGenerator candidateGenerator;
    private final MatchResolver matchResolver;
    private final MatchPersister matchPersister;
    private final ReportBuilder reportBuilder;
    private final TransactionRepository transactionRepository;
    private final LogbookEntryRepository logbookEntryRepository;
    private final ReconciliationMatchRepository matchRepository;
    private final MeterRegistry meterRegistry;

    @Value("${reconciliation.time-window-minutes:10}")
    private int timeWindowMinutes = 10;

    @Value("${reconciliation.amount-tolerance-percent:0}")
    private double amountTolerancePercent = 0;

    @Value("${reconciliation.minimum-match-score:0.8}")
    private double minimumMatchScore = 0.8;

    @Value("${reconciliation.auto-match-threshold:0.95}")
    private double autoMatchThreshold = 0.95;

    // Metrics
    private Counter runCounter;
    private Counter failedRunCounter;
    private Counter automaticMatchCounter;
    private Counter manualMatchCounter;
    private Counter conflictCounter;
    private Timer reconciliationTimer;

    public ReconciliationService(ReconciliationDataLoader dataLoader,
                                 CandidateGenerator candidateGenerator,
                                 MatchResolver matchResolver,
                                 MatchPersister matchPersister,
                                 ReportBuilder reportBuilder,
                                 TransactionRepository transactionRepository,
                                 LogbookEntryRepository logbookEntryRepository,
                                 ReconciliationMatchRepository matchRepository,
                                 MeterRegistry meterRegistry) {
        this.dataLoader = dataLoader;
        this.candidateGenerator = candidateGenerator;
        this.matchResolver = matchResolver;
        this.matchPersister = matchPersister;
        this.reportBuilder = reportBuilder;
        this.transactionRepository = transactionRepository;
        this.logbookEntryRepository = logbookEntryRepository;
        this.matchRepository = matchRepository;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        runCounter = Counter.builder("reconciliation.runs")
                .description("Reconciliation runs started")
                .register(meterRegistry);

        failedRunCounter = Counter.builder("reconciliation.runs.failed")
                .description("Reconciliation runs aborted by a store failure")
                .register(meterRegistry);

        automaticMatchCounter = Counter.builder("reconciliation.matches.automatic")
                .description("Automatic matches persisted")
                .register(meterRegistry);

        manualMatchCounter = Counter.builder("reconciliation.matches.manual")
                .description("Manual matches persisted")
                .register(meterRegistry);

        conflictCounter = Counter.builder("reconciliation.match.conflicts")
                .description("Automatic matches dropped because a concurrent writer claimed the entity first")
                .register(meterRegistry);

        reconciliationTimer = Timer.builder("reconciliation.duration")
                .description("Time taken to complete reconciliation run")
                .register(meterRegistry);
    }

    public ReconciliationReport runReconciliation(LocalDateTime startDate,
                                                  LocalDateTime endDate,
                                                  String userId,
                                                  ReconciliationConfig config) {
        return runReconciliation(startDate, endDate, userId, config, null);
    }

    /**
     * Main reconciliation entry point.
     *
     * @param userId        restricts the run to one user; null reconciles everyone
     * @param overrides     per-run matching parameters; null uses the configured defaults
     * @param correlationId id used to trace this run across logs; generated when null
     * @return the persisted report
     */
    public ReconciliationReport runReconciliation(LocalDateTime startDate,
                                                  LocalDateTime endDate,
                                                  String userId,
                                                  ReconciliationConfig overrides,
                                                  String correlationId) {
        validateDateRange(startDate, endDate);
        ReconciliationConfig config = resolveConfig(overrides);

        String runCorrelationId = hasText(correlationId) ? correlationId : UUID.randomUUID().toString();
        String reportId = UUID.randomUUID().toString();

        log.info("Starting reconciliation: reportId={}, startDate={}, endDate={}, userId={}, correlationId={}",
                reportId, startDate, endDate, userId != null ? userId : "all", runCorrelationId);
        runCounter.increment();
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            List<Transaction> transactions = dataLoader.loadTransactions(startDate, endDate, userId);
            List<LogbookEntry> entries = dataLoader.loadUnreconciledEntries(startDate, endDate, userId);

            log.info("Data fetched for reconciliation: {} transactions, {} logbook entries, correlationId={}",
                    transactions.size(), entries.size(), runCorrelationId);

            List<ReconciliationCandidate> candidates =
                    candidateGenerator.generateCandidates(transactions, entries, config);
            MatchResolver.Resolution resolution = matchResolver.resolve(candidates, config, runCorrelationId);

            List<ReconciliationMatch> persisted = new ArrayList<>();
            int conflicts = 0;
            for (ReconciliationMatch match : resolution.getMatches()) {
                if (persistAutomaticMatch(match, runCorrelationId)) {
                    persisted.add(match);
                } else {
                    resolution.getArena().release(match);
                    conflicts++;
                }
            }

            List<UnmatchedTransaction> unmatchedTransactions =
                    matchResolver.collectUnmatchedTransactions(transactions, candidates, resolution.getArena());
            List<UnmatchedLogbookEntry> unmatchedEntries =
                    matchResolver.collectUnmatchedLogbookEntries(entries, candidates, resolution.getArena());

            ReconciliationReport report = reportBuilder.assemble(
                    reportId,
                    startDate,
                    endDate,
                    transactions.size(),
                    entries.size(),
                    persisted,
                    unmatchedTransactions,
                    unmatchedEntries,
                    conflicts,
                    userId != null ? userId : SYSTEM_USER,
                    runCorrelationId);
            reportBuilder.store(report);

            log.info("Reconciliation completed: reportId={}, matched={}, unmatchedTransactions={}, " +
                            "unmatchedLogbookEntries={}, conflicts={}, matchRate={}, correlationId={}",
                    reportId,
                    persisted.size(),
                    unmatchedTransactions.size(),
                    unmatchedEntries.size(),
                    conflicts,
                    String.format("%.2f", report.getSummary().getMatchRate()),
                    runCorrelationId);

            return report;

        } catch (DataAccessException e) {
            failedRunCounter.increment();
            log.error("Reconciliation failed: startDate={}, endDate={}, userId={}, correlationId={}",
                    startDate, endDate, userId != null ? userId : "all", runCorrelationId, e);
            throw new ReconciliationRunException("Failed to run reconciliation", runCorrelationId, e);
        } catch (ReconciliationRunException e) {
            failedRunCounter.increment();
            log.error("Reconciliation failed: startDate={}, endDate={}, userId={}, correlationId={}",
                    startDate, endDate, userId != null ? userId : "all", runCorrelationId, e);
            throw e;
        } finally {
            sample.stop(reconciliationTimer);
        }
    }

    /**
     * Persists one automatic match.
     *
     * @return false if a concurrent writer already matched one of the two entities
     */
    private boolean persistAutomaticMatch(ReconciliationMatch match, String correlationId) {
        try {
            matchPersister.persist(match);
            automaticMatchCounter.increment();
            return true;
        } catch (DataIntegrityViolationException | ItemsAlreadyMatchedException e) {
            conflictCounter.increment();
            log.warn("Skipping match of transaction {} and logbook entry {}: already matched elsewhere, " +
                    "correlationId={}", match.getTransactionId(), match.getLogbookEntryId(), correlationId);
            return false;
        }
    }

    /**
     * Pairs a transaction and a logbook entry on a reviewer's say-so.
     * The heuristic is bypassed, so the score is always 1.0; differences are recorded for audit.
     */
    @Transactional
    public ReconciliationMatch createManualMatch(ManualMatchRequest request, String matchedBy) {
        validateManualMatch(request, matchedBy);

        Optional<Transaction> transaction = transactionRepository.findById(request.getTransactionId());
        Optional<LogbookEntry> entry = logbookEntryRepository.findById(request.getLogbookEntryId());

        if (transaction.isEmpty() || entry.isEmpty()) {
            log.warn("Manual match rejected, items not found: transactionId={}, logbookEntryId={}",
                    request.getTransactionId(), request.getLogbookEntryId());
            throw new MatchItemsNotFoundException(request.getTransactionId(), request.getLogbookEntryId());
        }

        Transaction tx = transaction.get();
        LogbookEntry logbookEntry = entry.get();

        if (logbookEntry.isReconciled()
                || matchRepository.existsByTransactionIdOrLogbookEntryId(tx.getId(), logbookEntry.getId())) {
            log.warn("Manual match rejected, items already matched: transactionId={}, logbookEntryId={}",
                    tx.getId(), logbookEntry.getId());
            throw new ItemsAlreadyMatchedException(tx.getId(), logbookEntry.getId());
        }

        boolean currencyMatch = tx.getCurrency().equals(logbookEntry.getCurrency());
        if (!currencyMatch) {
            log.info("Manual match across currencies: transactionId={} ({}), logbookEntryId={} ({})",
                    tx.getId(), tx.getCurrency(), logbookEntry.getId(), logbookEntry.getCurrency());
        }

        double timeDiff = CandidateGenerator.minutesBetween(tx.getCreatedAt(), logbookEntry.getCreatedAt());
        long amountDiff = Math.abs(tx.getAmountMinor() - logbookEntry.getAmountMinor());

        ReconciliationMatch match = ReconciliationMatch.builder()
                .id(UUID.randomUUID().toString())
                .logbookEntryId(logbookEntry.getId())
                .transactionId(tx.getId())
                .userId(tx.getUserId())
                .matchScore(1.0)
                .matchType(MatchType.MANUAL)
                .matchCriteria(MatchCriteria.builder()
                        .amountMatch(amountDiff == 0)
                        .timeMatch(timeDiff <= timeWindowMinutes)
                        .currencyMatch(currencyMatch)
                        .userMatch(tx.getUserId().equals(logbookEntry.getUserId()))
                        .build())
                .timeDifferenceMinutes(timeDiff)
                .amountDifferenceMinor(amountDiff)
                .matchedAt(LocalDateTime.now())
                .matchedBy(matchedBy)
                .notes(hasText(request.getNotes()) ? request.getNotes() : null)
                .build();

        try {
            matchRepository.saveAndFlush(match);
        } catch (DataIntegrityViolationException e) {
            log.warn("Manual match lost a race: transactionId={}, logbookEntryId={}", tx.getId(), logbookEntry.getId());
            throw new ItemsAlreadyMatchedException(tx.getId(), logbookEntry.getId(), e);
        }

        if (logbookEntryRepository.markReconciled(logbookEntry.getId(), tx.getId()) == 0) {
            throw new ItemsAlreadyMatchedException(tx.getId(), logbookEntry.getId());
        }

        manualMatchCounter.increment();
        log.info("Manual match created: matchId={}, transactionId={}, logbookEntryId={}, matchedBy={}",
                match.getId(), tx.getId(), logbookEntry.getId(), matchedBy);
        return match;
    }

    public Optional<ReconciliationReport> getReconciliationReport(String reportId) {
        if (!hasText(reportId)) {
            throw new InvalidReconciliationRequestException("Report ID is required");
        }
        return reportBuilder.load(reportId);
    }

    /**
     * Aggregates over matches created in {@code [startDate, endDate]}.
     */
    public ReconciliationMetrics getReconciliationMetrics(LocalDateTime startDate,
                                                          LocalDateTime endDate,
                                                          String userId) {
        validateDateRange(startDate, endDate);

        List<ReconciliationMatch> matches = matchRepository.findMatchedBetween(startDate, endDate, userId);
        long totalTransactions = transactionRepository.countInRange(
                TransactionStatus.SUCCESS, startDate, endDate, userId);

        long total = matches.size();
        long automatic = matches.stream().filter(m -> m.getMatchType() == MatchType.AUTOMATIC).count();

        return ReconciliationMetrics.builder()
                .matchRate(totalTransactions > 0 ? (total * 100.0) / totalTransactions : 0.0)
                .averageMatchScore(matches.stream()
                        .mapToDouble(ReconciliationMatch::getMatchScore).average().orElse(0.0))
                .averageTimeDifference(matches.stream()
                        .mapToDouble(ReconciliationMatch::getTimeDifferenceMinutes).average().orElse(0.0))
                .totalMatches(total)
                .automaticMatches(automatic)
                .manualMatches(total - automatic)
                .build();
    }

    /**
     * Configured defaults with the caller's overrides applied.
     */
    ReconciliationConfig resolveConfig(ReconciliationConfig overrides) {
        ReconciliationConfig defaults = ReconciliationConfig.builder()
                .timeWindowMinutes(timeWindowMinutes)
                .amountTolerancePercent(amountTolerancePercent)
                .minimumMatchScore(minimumMatchScore)
                .autoMatchThreshold(autoMatchThreshold)
                .build();

        ReconciliationConfig config = overrides != null ? overrides.mergeOnto(defaults) : defaults;
        validateConfig(config);
        return config;
    }

    private void validateConfig(ReconciliationConfig config) {
        List<String> problems = new ArrayList<>();
        if (config.getTimeWindowMinutes() < 1 || config.getTimeWindowMinutes() > 60) {
            problems.add("Time window must be between 1 and 60 minutes");
        }
        if (config.getAmountTolerancePercent() < 0 || config.getAmountTolerancePercent() > 10) {
            problems.add("Amount tolerance must be between 0 and 10 percent");
        }
        if (config.getMinimumMatchScore() < 0 || config.getMinimumMatchScore() > 1) {
            problems.add("Minimum match score must be between 0 and 1");
        }
        if (config.getAutoMatchThreshold() < 0 || config.getAutoMatchThreshold() > 1) {
            problems.add("Auto match threshold must be between 0 and 1");
        }
        if (!problems.isEmpty()) {
            throw new InvalidReconciliationRequestException(String.join("; ", problems));
        }
    }

    private void validateDateRange(LocalDateTime startDate, LocalDateTime endDate) {
        if (startDate == null || endDate == null) {
            throw new InvalidReconciliationRequestException("Start date and end date are required",
                    InvalidReconciliationRequestException.MISSING_DATE_RANGE);
        }
        if (startDate.isAfter(endDate)) {
            throw new InvalidReconciliationRequestException("Start date must not be after end date");
        }
    }

    private void validateManualMatch(ManualMatchRequest request, String matchedBy) {
        if (request == null || !hasText(request.getTransactionId()) || !hasText(request.getLogbookEntryId())) {
            throw new InvalidReconciliationRequestException("Transaction ID and logbook entry ID are required");
        }
        if (!hasText(matchedBy)) {
            throw new InvalidReconciliationRequestException("Matching user is required");
        }
        if (request.getNotes() != null && request.getNotes().length() > 500) {
            throw new InvalidReconciliationRequestException("Notes must not exceed 500 characters");
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

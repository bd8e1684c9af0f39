package com.fintech.expensereconciliation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.expensereconciliation.dto.ReconciliationReport;
import com.fintech.expensereconciliation.dto.ReconciliationReport.DateRange;
import com.fintech.expensereconciliation.dto.UnmatchedLogbookEntry;
import com.fintech.expensereconciliation.dto.UnmatchedTransaction;
import com.fintech.expensereconciliation.entity.ReconciliationMatch;
import com.fintech.expensereconciliation.entity.ReconciliationReportRecord;
import com.fintech.expensereconciliation.entity.ReconciliationSummary;
import com.fintech.expensereconciliation.exception.ReconciliationRunException;
import com.fintech.expensereconciliation.repository.ReconciliationReportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Assembles the outcome of a run into a {@link ReconciliationReport} and stores it.
 * Reports are written once and never updated.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReportBuilder {

    private static final TypeReference<List<ReconciliationMatch>> MATCHES = new TypeReference<>() { };
    private static final TypeReference<List<UnmatchedTransaction>> UNMATCHED_TRANSACTIONS = new TypeReference<>() { };
    private static final TypeReference<List<UnmatchedLogbookEntry>> UNMATCHED_ENTRIES = new TypeReference<>() { };

    private final ReconciliationReportRepository reportRepository;
    private final ObjectMapper objectMapper;

    public ReconciliationReport assemble(String reportId,
                                         LocalDateTime startDate,
                                         LocalDateTime endDate,
                                         int totalTransactions,
                                         int totalLogbookEntries,
                                         List<ReconciliationMatch> matches,
                                         List<UnmatchedTransaction> unmatchedTransactions,
                                         List<UnmatchedLogbookEntry> unmatchedLogbookEntries,
                                         int conflictsSkipped,
                                         String generatedBy,
                                         String correlationId) {
        ReconciliationSummary summary = ReconciliationSummary.builder()
                .totalTransactions(totalTransactions)
                .totalLogbookEntries(totalLogbookEntries)
                .matchedTransactions(matches.size())
                .unmatchedTransactions(unmatchedTransactions.size())
                .unmatchedLogbookEntries(unmatchedLogbookEntries.size())
                .matchRate(totalTransactions > 0 ? (matches.size() * 100.0) / totalTransactions : 0.0)
                .conflictsSkipped(conflictsSkipped)
                .build();

        return ReconciliationReport.builder()
                .id(reportId)
                .reportDate(startDate.toLocalDate())
                .dateRange(DateRange.builder().startDate(startDate).endDate(endDate).build())
                .summary(summary)
                .matches(matches)
                .unmatchedTransactions(unmatchedTransactions)
                .unmatchedLogbookEntries(unmatchedLogbookEntries)
                .generatedAt(LocalDateTime.now())
                .generatedBy(generatedBy)
                .correlationId(correlationId)
                .build();
    }

    public void store(ReconciliationReport report) {
        ReconciliationReportRecord record;
        try {
            record = ReconciliationReportRecord.builder()
                    .id(report.getId())
                    .reportDate(report.getReportDate())
                    .startDate(report.getDateRange().getStartDate())
                    .endDate(report.getDateRange().getEndDate())
                    .summary(report.getSummary())
                    .matchesJson(objectMapper.writeValueAsString(report.getMatches()))
                    .unmatchedTransactionsJson(objectMapper.writeValueAsString(report.getUnmatchedTransactions()))
                    .unmatchedLogbookEntriesJson(objectMapper.writeValueAsString(report.getUnmatchedLogbookEntries()))
                    .generatedAt(report.getGeneratedAt())
                    .generatedBy(report.getGeneratedBy())
                    .correlationId(report.getCorrelationId())
                    .build();
        } catch (JsonProcessingException e) {
            throw new ReconciliationRunException("Could not serialize reconciliation report " + report.getId(),
                    report.getCorrelationId(), e);
        }

        reportRepository.save(record);
        log.debug("Stored reconciliation report {}, correlationId={}", report.getId(), report.getCorrelationId());
    }

    public Optional<ReconciliationReport> load(String reportId) {
        return reportRepository.findById(reportId).map(this::toReport);
    }

    private ReconciliationReport toReport(ReconciliationReportRecord record) {
        try {
            return ReconciliationReport.builder()
                    .id(record.getId())
                    .reportDate(record.getReportDate())
                    .dateRange(DateRange.builder()
                            .startDate(record.getStartDate())
                            .endDate(record.getEndDate())
                            .build())
                    .summary(record.getSummary())
                    .matches(objectMapper.readValue(record.getMatchesJson(), MATCHES))
                    .unmatchedTransactions(objectMapper.readValue(record.getUnmatchedTransactionsJson(),
                            UNMATCHED_TRANSACTIONS))
                    .unmatchedLogbookEntries(objectMapper.readValue(record.getUnmatchedLogbookEntriesJson(),
                            UNMATCHED_ENTRIES))
                    .generatedAt(record.getGeneratedAt())
                    .generatedBy(record.getGeneratedBy())
                    .correlationId(record.getCorrelationId())
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored reconciliation report " + record.getId() + " is unreadable", e);
        }
    }
}

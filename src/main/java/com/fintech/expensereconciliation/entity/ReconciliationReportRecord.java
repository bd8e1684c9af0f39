package com.fintech.expensereconciliation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Stored form of a reconciliation report. The list sections are kept as JSON documents,
 * written once when the run completes.
 */
@Entity
@Immutable
@Table(name = "reconciliation_reports", indexes = {
        @Index(name = "idx_reconciliation_reports_report_date", columnList = "report_date"),
        @Index(name = "idx_reconciliation_reports_generated_at", columnList = "generated_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationReportRecord {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "report_date", nullable = false)
    private LocalDate reportDate;

    @Column(name = "start_date", nullable = false)
    private LocalDateTime startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDateTime endDate;

    @Embedded
    private ReconciliationSummary summary;

    @Column(name = "matches_json", nullable = false, columnDefinition = "TEXT")
    private String matchesJson;

    @Column(name = "unmatched_transactions_json", nullable = false, columnDefinition = "TEXT")
    private String unmatchedTransactionsJson;

    @Column(name = "unmatched_logbook_entries_json", nullable = false, columnDefinition = "TEXT")
    private String unmatchedLogbookEntriesJson;

    @Column(name = "generated_at", nullable = false)
    private LocalDateTime generatedAt;

    @Column(name = "generated_by", nullable = false, length = 36)
    private String generatedBy;

    @Column(name = "correlation_id", nullable = false, length = 100)
    private String correlationId;
}

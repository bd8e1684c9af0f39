package com.fintech.expensereconciliation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * A persisted pairing of one transaction with one logbook entry.
 * <p>
 * The unique constraints on {@code transaction_id} and {@code logbook_entry_id} are what keep
 * two overlapping reconciliation runs (or a run racing a reviewer) from matching the same
 * entity twice. The in-memory claim pass only protects a single run.
 */
@Entity
@Immutable
@Table(name = "reconciliation_matches",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_reconciliation_matches_transaction_id", columnNames = "transaction_id"),
                @UniqueConstraint(name = "uk_reconciliation_matches_logbook_entry_id", columnNames = "logbook_entry_id")
        },
        indexes = {
                @Index(name = "idx_reconciliation_matches_user_id", columnList = "user_id"),
                @Index(name = "idx_reconciliation_matches_matched_at", columnList = "matched_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationMatch {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "logbook_entry_id", nullable = false, length = 36)
    private String logbookEntryId;

    @Column(name = "transaction_id", nullable = false, length = 36)
    private String transactionId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "match_score", nullable = false)
    private double matchScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_type", nullable = false, length = 20)
    private MatchType matchType;

    @Embedded
    private MatchCriteria matchCriteria;

    @Column(name = "time_difference_minutes", nullable = false)
    private double timeDifferenceMinutes;

    @Column(name = "amount_difference_minor", nullable = false)
    private long amountDifferenceMinor;

    @Column(name = "matched_at", nullable = false)
    private LocalDateTime matchedAt;

    /**
     * Reviewer id, set for manual matches only.
     */
    @Column(name = "matched_by", length = 36)
    private String matchedBy;

    @Column(length = 500)
    private String notes;

    /**
     * Correlation id of the run that produced an automatic match.
     */
    @Column(name = "correlation_id", length = 36)
    private String correlationId;
}

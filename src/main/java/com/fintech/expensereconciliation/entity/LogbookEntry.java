package com.fintech.expensereconciliation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * An expense logged independently of the payment, often offline and synced later.
 * <p>
 * The reconciliation engine only ever flips {@code reconciled} and sets
 * {@code reconciledTransactionId}, and it does so through a conditional update
 * so an entry can never be linked twice.
 */
@Entity
@Table(name = "logbook_entries", indexes = {
        @Index(name = "idx_logbook_reconciled_created_at", columnList = "is_reconciled, created_at"),
        @Index(name = "idx_logbook_user_id", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogbookEntry {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(length = 30)
    private String type;

    @Column(name = "amount_minor", nullable = false)
    private long amountMinor;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(length = 500)
    private String note;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "is_reconciled", nullable = false)
    @Builder.Default
    private boolean reconciled = false;

    @Column(name = "reconciled_transaction_id", length = 36)
    private String reconciledTransactionId;

    @Version
    private Long version;
}

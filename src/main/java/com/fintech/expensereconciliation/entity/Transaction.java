package com.fintech.expensereconciliation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * A recorded payment transaction.
 * <p>
 * Rows are owned by the payment service; this service only reads them when
 * reconciling against logbook entries. Amounts are integer minor units (e.g. pesewas, cents).
 */
@Entity
@Immutable
@Table(name = "transactions", indexes = {
        @Index(name = "idx_transactions_status_created_at", columnList = "status, created_at"),
        @Index(name = "idx_transactions_user_id", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "amount_minor", nullable = false)
    private long amountMinor;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(length = 100)
    private String reference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

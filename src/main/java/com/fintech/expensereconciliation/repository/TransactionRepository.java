package com.fintech.expensereconciliation.repository;

import com.fintech.expensereconciliation.entity.Transaction;
import com.fintech.expensereconciliation.entity.TransactionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read access to the payment service's transactions.
 */
@Repository
public interface TransactionRepository extends JpaRepository<Transaction, String> {

    /**
     * Transactions in a status created inside {@code [start, end]}, optionally for a single user.
     */
    @Query("SELECT t FROM Transaction t WHERE t.status = :status " +
            "AND t.createdAt >= :start AND t.createdAt <= :end " +
            "AND (:userId IS NULL OR t.userId = :userId) " +
            "ORDER BY t.createdAt ASC")
    List<Transaction> findForReconciliation(
            @Param("status") TransactionStatus status,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end,
            @Param("userId") String userId
    );

    @Query("SELECT COUNT(t) FROM Transaction t WHERE t.status = :status " +
            "AND t.createdAt >= :start AND t.createdAt <= :end " +
            "AND (:userId IS NULL OR t.userId = :userId)")
    long countInRange(
            @Param("status") TransactionStatus status,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end,
            @Param("userId") String userId
    );
}

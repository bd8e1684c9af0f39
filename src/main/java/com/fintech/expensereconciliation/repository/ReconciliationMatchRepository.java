package com.fintech.expensereconciliation.repository;

import com.fintech.expensereconciliation.entity.ReconciliationMatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Insert-only store of matches. Rows are never updated once written.
 */
@Repository
public interface ReconciliationMatchRepository extends JpaRepository<ReconciliationMatch, String> {

    boolean existsByTransactionIdOrLogbookEntryId(String transactionId, String logbookEntryId);

    @Query("SELECT m.transactionId FROM ReconciliationMatch m WHERE m.transactionId IN :ids")
    List<String> findMatchedTransactionIds(@Param("ids") Collection<String> ids);

    @Query("SELECT m.logbookEntryId FROM ReconciliationMatch m WHERE m.logbookEntryId IN :ids")
    List<String> findMatchedLogbookEntryIds(@Param("ids") Collection<String> ids);

    @Query("SELECT m FROM ReconciliationMatch m WHERE m.matchedAt >= :start AND m.matchedAt <= :end " +
            "AND (:userId IS NULL OR m.userId = :userId)")
    List<ReconciliationMatch> findMatchedBetween(
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end,
            @Param("userId") String userId
    );
}

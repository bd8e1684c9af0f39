package com.fintech.expensereconciliation.repository;

import com.fintech.expensereconciliation.entity.LogbookEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface LogbookEntryRepository extends JpaRepository<LogbookEntry, String> {

    /**
     * Entries not yet linked to a transaction, created inside {@code [start, end]}.
     */
    @Query("SELECT e FROM LogbookEntry e WHERE e.reconciled = false " +
            "AND e.createdAt >= :start AND e.createdAt <= :end " +
            "AND (:userId IS NULL OR e.userId = :userId) " +
            "ORDER BY e.createdAt ASC")
    List<LogbookEntry> findUnreconciled(
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end,
            @Param("userId") String userId
    );

    /**
     * Links an entry to its transaction. Only succeeds while the entry is still unreconciled.
     *
     * @return number of rows updated, 0 if the entry was missing or already reconciled
     */
    @Modifying
    @Query("UPDATE LogbookEntry e SET e.reconciled = true, e.reconciledTransactionId = :transactionId, " +
            "e.version = e.version + 1 WHERE e.id = :entryId AND e.reconciled = false")
    int markReconciled(
            @Param("entryId") String entryId,
            @Param("transactionId") String transactionId
    );
}

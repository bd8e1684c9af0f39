package com.fintech.expensereconciliation.repository;

import com.fintech.expensereconciliation.entity.ReconciliationReportRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReconciliationReportRepository extends JpaRepository<ReconciliationReportRecord, String> {
}

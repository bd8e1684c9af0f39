package com.fintech.expensereconciliation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Expense Reconciliation Service
 * <p>
 * Matches successful payment transactions against logbook expense entries that users record
 * independently, often offline and synced later.
 * <p>
 * Key Features:
 * - Scored automatic matching with at most one match per transaction and per entry
 * - Manual matching of leftovers, with audit trail
 * - Stored, re-readable reconciliation reports
 * - Idempotency guard for payment-creating requests, backed by Redis
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class ExpenseReconciliationApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExpenseReconciliationApplication.class, args);
    }
}

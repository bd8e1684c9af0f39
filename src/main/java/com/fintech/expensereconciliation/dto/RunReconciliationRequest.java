package com.fintech.expensereconciliation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Body of {@code POST /api/v1/reconciliation/run}. Dates are checked by the service so that a
 * missing range reports {@code MISSING_DATE_RANGE} rather than a generic validation error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunReconciliationRequest {

    private LocalDateTime startDate;
    private LocalDateTime endDate;

    /**
     * Restricts the run to one user. Omit to reconcile everyone.
     */
    private String userId;

    private ReconciliationConfig config;
}

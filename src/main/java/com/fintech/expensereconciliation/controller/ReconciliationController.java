package com.fintech.expensereconciliation.controller;

import com.fintech.expensereconciliation.dto.ErrorResponse;
import com.fintech.expensereconciliation.dto.ManualMatchRequest;
import com.fintech.expensereconciliation.dto.ReconciliationMetrics;
import com.fintech.expensereconciliation.dto.ReconciliationReport;
import com.fintech.expensereconciliation.dto.RunReconciliationRequest;
import com.fintech.expensereconciliation.entity.ReconciliationMatch;
import com.fintech.expensereconciliation.service.ReconciliationService;
import com.fintech.expensereconciliation.web.IdempotencyGuardAspect;
import com.fintech.expensereconciliation.web.IdempotentEndpoint;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * REST API for reconciliation operations.
 * <p>
 * Provides endpoints for:
 * - Running reconciliation over a date range
 * - Manually matching leftovers
 * - Reading stored reports and aggregate metrics
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "Expense reconciliation operations API")
public class ReconciliationController {

    static final String USER_HEADER = "X-User-Id";
    static final String CORRELATION_HEADER = "X-Correlation-Id";

    private final ReconciliationService reconciliationService;

    @Operation(
            summary = "Run reconciliation",
            description = "Matches successful transactions against unreconciled logbook entries in the date range, persists automatic matches and returns the stored report. Safe to repeat: already matched items are skipped."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reconciliation completed",
                    content = @Content(schema = @Schema(implementation = ReconciliationReport.class))),
            @ApiResponse(responseCode = "400", description = "Missing date range or invalid matching parameters",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "500", description = "Run aborted by a store failure",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @Parameter(name = IdempotencyGuardAspect.IDEMPOTENCY_KEY_HEADER, in = ParameterIn.HEADER,
            description = "Repeats with the same key and body return the first report instead of running again")
    @IdempotentEndpoint
    @PostMapping("/run")
    public ResponseEntity<ReconciliationReport> runReconciliation(
            @RequestBody RunReconciliationRequest request,
            @Parameter(description = "Trace id for this run, generated when absent")
            @RequestHeader(value = CORRELATION_HEADER, required = false) String correlationId) {
        log.info("Reconciliation triggered via API: startDate={}, endDate={}, userId={}",
                request.getStartDate(), request.getEndDate(), request.getUserId());

        ReconciliationReport report = reconciliationService.runReconciliation(
                request.getStartDate(),
                request.getEndDate(),
                request.getUserId(),
                request.getConfig(),
                correlationId);
        return ResponseEntity.ok(report);
    }

    @Operation(
            summary = "Create manual match",
            description = "Pairs a transaction with a logbook entry regardless of score. Both must exist and be unmatched. A currency difference is recorded, not rejected."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Match created",
                    content = @Content(schema = @Schema(implementation = ReconciliationMatch.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "404", description = "Transaction or logbook entry not found"),
            @ApiResponse(responseCode = "409", description = "One of the items is already matched, or the idempotency key was used with a different body")
    })
    @Parameter(name = IdempotencyGuardAspect.IDEMPOTENCY_KEY_HEADER, in = ParameterIn.HEADER,
            description = "Repeats with the same key and body return the first match instead of failing with 409")
    @IdempotentEndpoint(userHeader = USER_HEADER)
    @PostMapping("/matches/manual")
    public ResponseEntity<ReconciliationMatch> createManualMatch(
            @Valid @RequestBody ManualMatchRequest request,
            @Parameter(description = "Reviewer creating the match")
            @RequestHeader(USER_HEADER) String userId) {
        ReconciliationMatch match = reconciliationService.createManualMatch(request, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(match);
    }

    @Operation(summary = "Get reconciliation report", description = "Returns a stored report by id.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Report found",
                    content = @Content(schema = @Schema(implementation = ReconciliationReport.class))),
            @ApiResponse(responseCode = "404", description = "Report not found")
    })
    @GetMapping("/reports/{reportId}")
    public ResponseEntity<ReconciliationReport> getReport(
            @Parameter(description = "Report ID") @PathVariable String reportId) {
        return reconciliationService.getReconciliationReport(reportId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(
            summary = "Get reconciliation metrics",
            description = "Match rate, average score and time difference, and automatic/manual split for matches created in the range."
    )
    @ApiResponse(responseCode = "200", description = "Metrics computed",
            content = @Content(schema = @Schema(implementation = ReconciliationMetrics.class)))
    @GetMapping("/metrics")
    public ResponseEntity<ReconciliationMetrics> getMetrics(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate,
            @Parameter(description = "Restrict to one user") @RequestParam(required = false) String userId) {
        return ResponseEntity.ok(reconciliationService.getReconciliationMetrics(startDate, endDate, userId));
    }

    @Operation(
            summary = "Health check",
            description = "Returns the health status of the reconciliation service. Used by load balancers and monitoring systems."
    )
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "expense-reconciliation",
                "timestamp", LocalDateTime.now().toString()
        ));
    }
}

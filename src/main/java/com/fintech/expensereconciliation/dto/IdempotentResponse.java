package com.fintech.expensereconciliation.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a payment-creating operation guarded by an idempotency key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotentResponse {

    private String transactionId;
    private JsonNode response;

    /**
     * True when this came from a stored record rather than a fresh execution.
     */
    private boolean replayed;
}

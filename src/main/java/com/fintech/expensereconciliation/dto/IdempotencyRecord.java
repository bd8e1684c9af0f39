package com.fintech.expensereconciliation.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Value stored in the TTL store under {@code idempotency:{userId}:{key}}.
 * <p>
 * Written first as an {@link State#IN_PROGRESS} reservation by whichever request wins the
 * set-if-absent, then overwritten once with the {@link State#COMPLETED} response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecord {

    public enum State {
        IN_PROGRESS,
        COMPLETED
    }

    private String key;
    private String userId;
    private State state;
    private String transactionId;
    private String requestHash;
    private JsonNode response;
    private Instant createdAt;
    private Instant expiresAt;

    @JsonIgnore
    public boolean isCompleted() {
        return state == State.COMPLETED;
    }
}

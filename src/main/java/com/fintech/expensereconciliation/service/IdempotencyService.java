package com.fintech.expensereconciliation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fintech.expensereconciliation.dto.IdempotencyRecord;
import com.fintech.expensereconciliation.dto.IdempotentResponse;
import com.fintech.expensereconciliation.exception.IdempotencyConflictException;
import com.fintech.expensereconciliation.exception.IdempotencyInFlightException;
import com.fintech.expensereconciliation.exception.IdempotencyStoreException;
import com.fintech.expensereconciliation.exception.InvalidReconciliationRequestException;
import com.fintech.expensereconciliation.store.TtlKeyValueStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Deduplicates payment-creating requests by a client-supplied idempotency key.
 * <p>
 * Records are scoped per user ({@code idempotency:{userId}:{key}}) and expire after a fixed TTL.
 * A key reused with a different request body is a conflict, never an overwrite.
 * <p>
 * Concurrency: the first request atomically reserves the key with a set-if-absent, so of two
 * identical requests arriving together only one does the work. The other waits briefly for the
 * stored response or gives up with a retryable in-flight error.
 * <p>
 * If the TTL store is unreachable the guard fails open: the request runs unguarded and the
 * bypass is logged and counted in {@code idempotency.store.failures}.
 */
@Service
@Slf4j
public class IdempotencyService {

    static final String KEY_PREFIX = "idempotency:";

    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,255}$");
    private static final String KEY_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final TtlKeyValueStore store;
    private final ObjectMapper objectMapper;
    private final ObjectMapper canonicalMapper;
    private final MeterRegistry meterRegistry;
    private final Counter storeFailureCounter;

    @Value("${idempotency.ttl-seconds:900}")
    private long ttlSeconds = 900;

    @Value("${idempotency.reservation-ttl-seconds:120}")
    private long reservationTtlSeconds = 120;

    @Value("${idempotency.in-flight-wait-ms:2000}")
    private long inFlightWaitMs = 2000;

    @Value("${idempotency.poll-interval-ms:100}")
    private long pollIntervalMs = 100;

    public IdempotencyService(TtlKeyValueStore store, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.canonicalMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.meterRegistry = meterRegistry;
        this.storeFailureCounter = Counter.builder("idempotency.store.failures")
                .description("Idempotency store calls that failed and were bypassed")
                .register(meterRegistry);
    }

    /**
     * Looks up a previous request with the same key.
     *
     * @return the stored response if the same body was already processed, empty for a new request
     * @throws IdempotencyConflictException if the key was used with a different body
     * @throws IdempotencyInFlightException if the original request is still being processed
     */
    public Optional<IdempotentResponse> checkIdempotency(String idempotencyKey, String userId, String requestHash) {
        Optional<IdempotencyRecord> existing;
        try {
            existing = store.get(buildStoreKey(idempotencyKey, userId)).map(this::readRecord);
        } catch (IdempotencyStoreException e) {
            failOpen("check", idempotencyKey, userId, e);
            return Optional.empty();
        }

        if (existing.isEmpty()) {
            countCheck("new");
            return Optional.empty();
        }
        return Optional.of(replayOrReject(existing.get(), idempotencyKey, userId, requestHash));
    }

    /**
     * Atomically claims the key for this request.
     *
     * @throws IdempotencyConflictException if the key is held by a request with a different body
     */
    public Reservation reserve(String idempotencyKey, String userId, String requestHash) {
        String storeKey = buildStoreKey(idempotencyKey, userId);
        Instant now = Instant.now();
        Duration reservationTtl = Duration.ofSeconds(reservationTtlSeconds);

        try {
            IdempotencyRecord marker = IdempotencyRecord.builder()
                    .key(idempotencyKey)
                    .userId(userId)
                    .state(IdempotencyRecord.State.IN_PROGRESS)
                    .requestHash(requestHash)
                    .createdAt(now)
                    .expiresAt(now.plus(reservationTtl))
                    .build();

            if (store.setIfAbsent(storeKey, writeRecord(marker), reservationTtl)) {
                countCheck("new");
                log.debug("Idempotency key reserved: key={}, userId={}", idempotencyKey, userId);
                return Reservation.acquired();
            }

            Optional<IdempotencyRecord> existing = store.get(storeKey).map(this::readRecord);
            if (existing.isEmpty()) {
                // released or expired between the two calls
                return Reservation.inFlight();
            }
            return Reservation.replayed(replayOrReject(existing.get(), idempotencyKey, userId, requestHash));

        } catch (IdempotencyInFlightException e) {
            return Reservation.inFlight();
        } catch (IdempotencyStoreException e) {
            failOpen("reserve", idempotencyKey, userId, e);
            return Reservation.unguarded();
        }
    }

    /**
     * Records the outcome of a successfully processed request.
     * <p>
     * The completed record is written only if the key is free or still holds an IN_PROGRESS
     * reservation for the same request hash. A key now held for a different body, or already
     * completed, is left as it is; the skip is logged and counted in
     * {@code idempotency.record.rejected}.
     */
    public void storeIdempotencyRecord(String idempotencyKey,
                                       String userId,
                                       String transactionId,
                                       String requestHash,
                                       Object response) {
        String storeKey = buildStoreKey(idempotencyKey, userId);
        Instant now = Instant.now();
        Duration ttl = Duration.ofSeconds(ttlSeconds);

        try {
            IdempotencyRecord record = IdempotencyRecord.builder()
                    .key(idempotencyKey)
                    .userId(userId)
                    .state(IdempotencyRecord.State.COMPLETED)
                    .transactionId(transactionId)
                    .requestHash(requestHash)
                    .response(objectMapper.valueToTree(response))
                    .createdAt(now)
                    .expiresAt(now.plus(ttl))
                    .build();
            String completed = writeRecord(record);

            Optional<String> current = store.get(storeKey);
            boolean stored;
            if (current.isEmpty()) {
                stored = store.setIfAbsent(storeKey, completed, ttl);
            } else {
                IdempotencyRecord existing = readRecord(current.get());
                if (!sameRequest(existing, requestHash)) {
                    rejectRecord("hash_mismatch", idempotencyKey, userId, transactionId);
                    return;
                }
                if (existing.isCompleted()) {
                    rejectRecord("already_completed", idempotencyKey, userId, transactionId);
                    return;
                }
                stored = store.compareAndSet(storeKey, current.get(), completed, ttl);
            }

            if (!stored) {
                rejectRecord("superseded", idempotencyKey, userId, transactionId);
                return;
            }
            log.info("Idempotency record stored: key={}, userId={}, transactionId={}, ttlSeconds={}",
                    idempotencyKey, userId, transactionId, ttlSeconds);
        } catch (IdempotencyStoreException e) {
            failOpen("store", idempotencyKey, userId, e);
        }
    }

    /**
     * Forgets a key so that a retry after a failed operation is treated as a new request.
     */
    public void removeIdempotencyRecord(String idempotencyKey, String userId) {
        try {
            store.delete(buildStoreKey(idempotencyKey, userId));
            log.info("Idempotency record removed: key={}, userId={}", idempotencyKey, userId);
        } catch (IdempotencyStoreException e) {
            failOpen("remove", idempotencyKey, userId, e);
        }
    }

    /**
     * Runs a payment-creating operation at most once per (user, key, body).
     * <p>
     * The winner of the reservation runs the operation and stores its response; a failed
     * operation releases the key and rethrows. Concurrent duplicates wait up to
     * {@code idempotency.in-flight-wait-ms} for that response.
     *
     * @throws InvalidReconciliationRequestException if the key is malformed
     * @throws IdempotencyConflictException          if the key was used with a different body
     * @throws IdempotencyInFlightException          if the original request did not finish in time
     */
    public IdempotentResponse execute(String idempotencyKey,
                                      String userId,
                                      Object requestBody,
                                      Supplier<IdempotentResponse> operation) {
        if (!validateIdempotencyKey(idempotencyKey)) {
            throw new InvalidReconciliationRequestException("Invalid idempotency key format");
        }
        String requestHash = generateRequestHash(requestBody);
        long deadline = System.currentTimeMillis() + inFlightWaitMs;

        Reservation reservation = reserve(idempotencyKey, userId, requestHash);
        while (reservation.getStatus() == Reservation.Status.IN_FLIGHT) {
            if (System.currentTimeMillis() >= deadline) {
                countCheck("in_flight");
                log.warn("Idempotent request still in flight, giving up: key={}, userId={}", idempotencyKey, userId);
                throw new IdempotencyInFlightException(idempotencyKey);
            }
            pause(idempotencyKey);
            reservation = reserve(idempotencyKey, userId, requestHash);
        }

        switch (reservation.getStatus()) {
            case REPLAYED:
                return reservation.getResponse();
            case UNGUARDED:
                log.warn("Processing request without idempotency protection: key={}, userId={}",
                        idempotencyKey, userId);
                return operation.get();
            default:
                break;
        }

        IdempotentResponse result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            log.info("Guarded operation failed, releasing idempotency key: key={}, userId={}",
                    idempotencyKey, userId);
            removeIdempotencyRecord(idempotencyKey, userId);
            throw e;
        }

        storeIdempotencyRecord(idempotencyKey, userId, result.getTransactionId(), requestHash, result.getResponse());
        return IdempotentResponse.builder()
                .transactionId(result.getTransactionId())
                .response(result.getResponse())
                .replayed(false)
                .build();
    }

    /**
     * SHA-256 of the request body with object keys sorted at every depth, so the same payload
     * hashes the same regardless of field order. A {@link String} body is parsed as JSON.
     */
    public String generateRequestHash(Object requestBody) {
        try {
            JsonNode tree = requestBody instanceof String
                    ? objectMapper.readTree((String) requestBody)
                    : objectMapper.valueToTree(requestBody);
            Object plain = canonicalMapper.treeToValue(tree, Object.class);
            String normalized = canonicalMapper.writeValueAsString(plain);

            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidReconciliationRequestException("Request body is not valid JSON");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 1-255 characters, alphanumeric with hyphens and underscores.
     */
    public boolean validateIdempotencyKey(String key) {
        return key != null && KEY_PATTERN.matcher(key).matches();
    }

    /**
     * Creates a key of the form {@code prefix_epochMillis_random}, for clients and tests.
     */
    public String generateIdempotencyKey(String prefix) {
        StringBuilder random = new StringBuilder(6);
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        for (int i = 0; i < 6; i++) {
            random.append(KEY_ALPHABET.charAt(rnd.nextInt(KEY_ALPHABET.length())));
        }
        return String.format("%s_%d_%s", prefix != null ? prefix : "txn", System.currentTimeMillis(), random);
    }

    private IdempotentResponse replayOrReject(IdempotencyRecord record,
                                              String idempotencyKey,
                                              String userId,
                                              String requestHash) {
        if (!sameRequest(record, requestHash)) {
            countCheck("conflict");
            log.warn("Idempotency key reused with different request body: key={}, userId={}",
                    idempotencyKey, userId);
            throw new IdempotencyConflictException(idempotencyKey);
        }
        if (!record.isCompleted()) {
            throw new IdempotencyInFlightException(idempotencyKey);
        }

        countCheck("replay");
        log.info("Idempotent request detected: key={}, userId={}, originalTransactionId={}, createdAt={}",
                idempotencyKey, userId, record.getTransactionId(), record.getCreatedAt());
        return IdempotentResponse.builder()
                .transactionId(record.getTransactionId())
                .response(record.getResponse())
                .replayed(true)
                .build();
    }

    private static boolean sameRequest(IdempotencyRecord record, String requestHash) {
        return record.getRequestHash() != null && Objects.equals(record.getRequestHash(), requestHash);
    }

    private void rejectRecord(String reason, String idempotencyKey, String userId, String transactionId) {
        meterRegistry.counter("idempotency.record.rejected", "reason", reason).increment();
        log.warn("Idempotency record not stored ({}): key={}, userId={}, transactionId={}",
                reason, idempotencyKey, userId, transactionId);
    }

    private void pause(String idempotencyKey) {
        try {
            Thread.sleep(pollIntervalMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdempotencyInFlightException(idempotencyKey);
        }
    }

    private String buildStoreKey(String idempotencyKey, String userId) {
        return KEY_PREFIX + userId + ":" + idempotencyKey;
    }

    private String writeRecord(IdempotencyRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IdempotencyStoreException("Could not serialize idempotency record " + record.getKey(), e);
        }
    }

    private IdempotencyRecord readRecord(String json) {
        try {
            return objectMapper.readValue(json, IdempotencyRecord.class);
        } catch (JsonProcessingException e) {
            throw new IdempotencyStoreException("Unreadable idempotency record", e);
        }
    }

    private void failOpen(String operation, String idempotencyKey, String userId, IdempotencyStoreException e) {
        storeFailureCounter.increment();
        log.error("Idempotency {} failed, continuing without protection: key={}, userId={}, error={}",
                operation, idempotencyKey, userId, e.getMessage());
    }

    private void countCheck(String result) {
        meterRegistry.counter("idempotency.check", "result", result).increment();
    }

    /**
     * Outcome of {@link #reserve}.
     */
    public static final class Reservation {

        public enum Status {
            /** This request owns the key and must do the work. */
            ACQUIRED,
            /** The same request was already processed; the stored response is attached. */
            REPLAYED,
            /** The same request is being processed by someone else. */
            IN_FLIGHT,
            /** The store is unavailable; proceed without protection. */
            UNGUARDED
        }

        private final Status status;
        private final IdempotentResponse response;

        private Reservation(Status status, IdempotentResponse response) {
            this.status = status;
            this.response = response;
        }

        static Reservation acquired() {
            return new Reservation(Status.ACQUIRED, null);
        }

        static Reservation replayed(IdempotentResponse response) {
            return new Reservation(Status.REPLAYED, response);
        }

        static Reservation inFlight() {
            return new Reservation(Status.IN_FLIGHT, null);
        }

        static Reservation unguarded() {
            return new Reservation(Status.UNGUARDED, null);
        }

        public Status getStatus() {
            return status;
        }

        public IdempotentResponse getResponse() {
            return response;
        }
    }
}

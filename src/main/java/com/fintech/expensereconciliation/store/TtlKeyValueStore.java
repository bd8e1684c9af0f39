package com.fintech.expensereconciliation.store;

import com.fintech.expensereconciliation.exception.IdempotencyStoreException;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store with per-entry expiry, used by the idempotency guard.
 * <p>
 * Implementations:
 * - RedisTtlKeyValueStore (default, shared across instances)
 * - InMemoryTtlKeyValueStore (single instance, tests and local runs)
 */
public interface TtlKeyValueStore {

    /**
     * @throws IdempotencyStoreException if the store is unreachable
     */
    Optional<String> get(String key);

    /**
     * Atomically writes the value only if no live entry exists for the key.
     *
     * @return true if this call created the entry
     * @throws IdempotencyStoreException if the store is unreachable
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Atomically replaces the value, and resets its expiry, only if the live entry still holds
     * {@code expectedValue}.
     *
     * @return true if the value was replaced
     * @throws IdempotencyStoreException if the store is unreachable
     */
    boolean compareAndSet(String key, String expectedValue, String newValue, Duration ttl);

    /**
     * @throws IdempotencyStoreException if the store is unreachable
     */
    void delete(String key);
}

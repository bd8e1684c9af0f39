package com.fintech.expensereconciliation.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-process TTL store. Expired entries are dropped on access and by a periodic sweep
 * ({@code idempotency.memory.sweep-interval-ms}).
 * <p>
 * Only suitable when one instance handles all payment requests; enable with
 * {@code idempotency.store=memory}.
 */
@Component
@ConditionalOnProperty(name = "idempotency.store", havingValue = "memory")
@Slf4j
public class InMemoryTtlKeyValueStore implements TtlKeyValueStore {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTtlKeyValueStore() {
        this(Clock.systemUTC());
    }

    InMemoryTtlKeyValueStore(Clock clock) {
        this.clock = clock;
        log.info("Using in-memory TTL store for idempotency records");
    }

    @Override
    public Optional<String> get(String key) {
        Instant now = clock.instant();
        Entry entry = entries.computeIfPresent(key, (k, existing) -> existing.isExpired(now) ? null : existing);
        return Optional.ofNullable(entry).map(Entry::value);
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean created = new AtomicBoolean(false);
        entries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            created.set(true);
            return new Entry(value, now.plus(ttl));
        });
        return created.get();
    }

    @Override
    public boolean compareAndSet(String key, String expectedValue, String newValue, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean replaced = new AtomicBoolean(false);
        entries.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                return null;
            }
            if (!existing.value().equals(expectedValue)) {
                return existing;
            }
            replaced.set(true);
            return new Entry(newValue, now.plus(ttl));
        });
        return replaced.get();
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Scheduled(fixedDelayString = "${idempotency.memory.sweep-interval-ms:60000}")
    public void sweepExpired() {
        int evicted = evictExpired();
        if (evicted > 0) {
            log.debug("Evicted {} expired idempotency entries, {} remaining", evicted, entries.size());
        }
    }

    int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Map.Entry<String, Entry> candidate : entries.entrySet()) {
            if (candidate.getValue().isExpired(now) && entries.remove(candidate.getKey(), candidate.getValue())) {
                evicted++;
            }
        }
        return evicted;
    }

    int size() {
        return entries.size();
    }

    private static final class Entry {
        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        String value() {
            return value;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}

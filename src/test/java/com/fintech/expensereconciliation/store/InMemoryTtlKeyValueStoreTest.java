package com.fintech.expensereconciliation.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTtlKeyValueStoreTest {

    private MutableClock clock;
    private InMemoryTtlKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
        store = new InMemoryTtlKeyValueStore(clock);
    }

    @Test
    @DisplayName("Values expire after their TTL")
    void valuesExpire() {
        store.setIfAbsent("k", "v", Duration.ofSeconds(900));

        clock.advance(Duration.ofSeconds(899));
        assertThat(store.get("k")).contains("v");

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.get("k")).isEmpty();
    }

    @Test
    @DisplayName("setIfAbsent only succeeds once while the value is live")
    void setIfAbsentOnce() {
        assertThat(store.setIfAbsent("k", "first", Duration.ofSeconds(120))).isTrue();
        assertThat(store.setIfAbsent("k", "second", Duration.ofSeconds(120))).isFalse();
        assertThat(store.get("k")).contains("first");
    }

    @Test
    @DisplayName("setIfAbsent succeeds again once the previous value expired")
    void setIfAbsentAfterExpiry() {
        store.setIfAbsent("k", "first", Duration.ofSeconds(120));
        clock.advance(Duration.ofSeconds(121));

        assertThat(store.setIfAbsent("k", "second", Duration.ofSeconds(120))).isTrue();
        assertThat(store.get("k")).contains("second");
    }

    @Test
    @DisplayName("delete removes the value")
    void deleteRemoves() {
        store.setIfAbsent("k", "v", Duration.ofSeconds(60));
        store.delete("k");

        assertThat(store.get("k")).isEmpty();
    }

    @Test
    @DisplayName("compareAndSet replaces only the expected value and resets the expiry")
    void compareAndSetReplacesExpectedValue() {
        store.setIfAbsent("k", "reserved", Duration.ofSeconds(120));

        assertThat(store.compareAndSet("k", "someone-else", "done", Duration.ofSeconds(900))).isFalse();
        assertThat(store.get("k")).contains("reserved");

        assertThat(store.compareAndSet("k", "reserved", "done", Duration.ofSeconds(900))).isTrue();
        clock.advance(Duration.ofSeconds(600));
        assertThat(store.get("k")).contains("done");
    }

    @Test
    @DisplayName("compareAndSet does not revive an expired or missing entry")
    void compareAndSetIgnoresExpiredEntries() {
        store.setIfAbsent("k", "reserved", Duration.ofSeconds(120));
        clock.advance(Duration.ofSeconds(120));

        assertThat(store.compareAndSet("k", "reserved", "done", Duration.ofSeconds(900))).isFalse();
        assertThat(store.compareAndSet("missing", "reserved", "done", Duration.ofSeconds(900))).isFalse();
        assertThat(store.get("k")).isEmpty();
    }

    @Test
    @DisplayName("Sweeping evicts expired entries that are never read again")
    void sweepEvictsExpiredEntries() {
        store.setIfAbsent("old-1", "v", Duration.ofSeconds(60));
        store.setIfAbsent("old-2", "v", Duration.ofSeconds(60));
        store.setIfAbsent("fresh", "v", Duration.ofSeconds(900));
        clock.advance(Duration.ofSeconds(61));

        assertThat(store.evictExpired()).isEqualTo(2);
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("fresh")).contains("v");
    }

    @Test
    @DisplayName("Exactly one of many concurrent setIfAbsent calls wins")
    void concurrentSetIfAbsent() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String value = "v" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    return store.setIfAbsent("k", value, Duration.ofSeconds(60));
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

package com.fintech.expensereconciliation.store;

import com.fintech.expensereconciliation.exception.IdempotencyStoreException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Redis-backed TTL store. {@link #setIfAbsent} maps to {@code SET key value NX PX ttl},
 * and {@link #compareAndSet} to a GET/SET Lua script; both are atomic on the Redis side.
 * <p>
 * Every call goes through the {@code idempotency-store} circuit breaker so that a Redis
 * outage fails fast instead of holding payment requests on connection timeouts.
 */
@Component
@ConditionalOnProperty(name = "idempotency.store", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisTtlKeyValueStore implements TtlKeyValueStore {

    static final String CIRCUIT_BREAKER_NAME = "idempotency-store";

    static final RedisScript<Long> COMPARE_AND_SET = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then "
                    + "redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3]) "
                    + "return 1 "
                    + "end "
                    + "return 0",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final CircuitBreaker circuitBreaker;

    public RedisTtlKeyValueStore(StringRedisTemplate redisTemplate,
                                 CircuitBreakerRegistry circuitBreakerRegistry) {
        this.redisTemplate = redisTemplate;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
    }

    @Override
    public Optional<String> get(String key) {
        return call("GET", key, () -> Optional.ofNullable(redisTemplate.opsForValue().get(key)));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return call("SETNX", key,
                () -> Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl)));
    }

    @Override
    public boolean compareAndSet(String key, String expectedValue, String newValue, Duration ttl) {
        return call("CAS", key, () -> Long.valueOf(1L).equals(redisTemplate.execute(COMPARE_AND_SET,
                Collections.singletonList(key), expectedValue, newValue, String.valueOf(ttl.toMillis()))));
    }

    @Override
    public void delete(String key) {
        call("DEL", key, () -> redisTemplate.delete(key));
    }

    private <T> T call(String operation, String key, Supplier<T> command) {
        try {
            return circuitBreaker.executeSupplier(command);
        } catch (CallNotPermittedException e) {
            throw new IdempotencyStoreException(
                    "Redis circuit breaker is open, skipped " + operation + " " + key, e);
        } catch (DataAccessException e) {
            log.debug("Redis {} failed for key {}: {}", operation, key, e.getMessage());
            throw new IdempotencyStoreException("Redis " + operation + " failed for key " + key, e);
        }
    }
}

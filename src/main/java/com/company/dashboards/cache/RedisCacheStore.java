package com.company.dashboards.cache;

import com.company.dashboards.domain.enums.CacheStatus;
import com.company.dashboards.dto.response.CacheHealth;
import com.company.dashboards.exception.CacheUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Shared cache backed by Redis. Values are stored as JSON strings; pattern invalidation walks
 * the keyspace with SCAN and deletes in batches so it never blocks the server like KEYS would.
 * All calls pass through a circuit breaker, so a dead Redis costs one fast failure per call
 * instead of a connect timeout.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisCacheStore implements CacheStore {

    static final int SCAN_BATCH_SIZE = 500;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;

    /**
     * Mapper for cached values. Untyped numbers read back as {@code Long} or {@code BigDecimal},
     * the same types query rows carry, so a Redis hit equals the value that was stored.
     */
    public static ObjectMapper cacheObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.USE_LONG_FOR_INTS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        String json = call("get", () -> redisTemplate.opsForValue().get(key));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            call("delete", () -> redisTemplate.delete(key));
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for " + key + " is not JSON serializable", e);
        }
        call("set", () -> {
            if (ttl != null) {
                redisTemplate.opsForValue().set(key, json, ttl);
            } else {
                redisTemplate.opsForValue().set(key, json);
            }
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(call("delete", () -> redisTemplate.delete(key)));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(call("exists", () -> redisTemplate.hasKey(key)));
    }

    @Override
    public long invalidatePattern(String glob) {
        Long removed = call("invalidatePattern", () -> scanAndDelete(glob));
        log.debug("Invalidated {} Redis keys matching {}", removed, glob);
        return removed != null ? removed : 0L;
    }

    @Override
    public CacheHealth health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("circuitBreaker", circuitBreaker.getState().name());
        try {
            String pong = call("ping", () -> redisTemplate.execute(
                    (RedisCallback<String>) RedisConnection::ping));
            details.put("ping", pong);
            return CacheHealth.builder()
                    .status("PONG".equalsIgnoreCase(pong) ? CacheStatus.HEALTHY : CacheStatus.DEGRADED)
                    .backend("redis")
                    .details(details)
                    .build();
        } catch (CacheUnavailableException e) {
            details.put("error", e.getMessage());
            return CacheHealth.builder()
                    .status(CacheStatus.DEGRADED)
                    .backend("redis")
                    .details(details)
                    .build();
        }
    }

    private long scanAndDelete(String glob) {
        ScanOptions options = ScanOptions.scanOptions().match(glob).count(SCAN_BATCH_SIZE).build();
        List<String> batch = new ArrayList<>(SCAN_BATCH_SIZE);
        long removed = 0;
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= SCAN_BATCH_SIZE) {
                    removed += deleteBatch(batch);
                    batch.clear();
                }
            }
        }
        removed += deleteBatch(batch);
        return removed;
    }

    private long deleteBatch(List<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(keys);
        return deleted != null ? deleted : 0;
    }

    private <T> T call(String operation, Supplier<T> command) {
        try {
            return circuitBreaker.executeSupplier(command);
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }
}

package com.company.dashboards.cache;

import com.company.dashboards.dto.response.CacheHealth;
import com.company.dashboards.exception.CacheUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Entry point the orchestrators use for caching. Backend outages degrade to misses and
 * failed writes; they never reach the caller.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheLayer {

    private final CacheStore store;
    private final MeterRegistry meterRegistry;

    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            Optional<T> value = store.get(key, type);
            meterRegistry.counter("dashboards.cache.requests",
                    "result", value.isPresent() ? "hit" : "miss").increment();
            log.debug("Cache {} for {}", value.isPresent() ? "HIT" : "MISS", key);
            return value;
        } catch (CacheUnavailableException e) {
            recordFailure("get", key, e);
            return Optional.empty();
        }
    }

    /**
     * @return whether the value was stored
     */
    public boolean set(String key, Object value, Duration ttl) {
        try {
            store.set(key, value, ttl);
            return true;
        } catch (CacheUnavailableException e) {
            recordFailure("set", key, e);
            return false;
        }
    }

    public boolean delete(String key) {
        try {
            return store.delete(key);
        } catch (CacheUnavailableException e) {
            recordFailure("delete", key, e);
            return false;
        }
    }

    public boolean exists(String key) {
        try {
            return store.exists(key);
        } catch (CacheUnavailableException e) {
            recordFailure("exists", key, e);
            return false;
        }
    }

    public long invalidatePattern(String glob) {
        try {
            return store.invalidatePattern(glob);
        } catch (CacheUnavailableException e) {
            recordFailure("invalidatePattern", glob, e);
            return 0;
        }
    }

    public CacheHealth health() {
        return store.health();
    }

    private void recordFailure(String operation, String key, CacheUnavailableException e) {
        meterRegistry.counter("dashboards.cache.errors", "operation", operation).increment();
        log.warn("Cache {} degraded for {}: {}", operation, key, e.getMessage());
    }
}

package com.company.dashboards.cache;

import com.company.dashboards.dto.response.CacheHealth;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store with per-entry TTL. Backends must behave identically: a {@code get} within
 * the TTL of a {@code set} returns that value, a {@code get} after expiry returns empty.
 * <p>
 * Remote backends signal an unreachable server with
 * {@link com.company.dashboards.exception.CacheUnavailableException}; callers go through
 * {@link CacheLayer}, which turns that into a miss.
 */
public interface CacheStore {

    <T> Optional<T> get(String key, Class<T> type);

    /**
     * @param ttl time to live; {@code null} keeps the entry until evicted or deleted
     */
    void set(String key, Object value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    /**
     * Removes every key matching a Redis-style glob.
     *
     * @return number of keys removed
     */
    long invalidatePattern(String glob);

    /**
     * Never throws; an unreachable backend reports {@code DEGRADED}.
     */
    CacheHealth health();
}

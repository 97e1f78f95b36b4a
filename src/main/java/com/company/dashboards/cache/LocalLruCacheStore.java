package com.company.dashboards.cache;

import com.company.dashboards.domain.enums.CacheStatus;
import com.company.dashboards.dto.response.CacheHealth;
import com.company.dashboards.util.GlobPattern;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Bounded single-process cache with least-recently-used eviction. Expired entries are
 * dropped lazily when touched or when room is needed; there is no background sweeper.
 */
@Slf4j
public class LocalLruCacheStore implements CacheStore {

    private final int maxEntries;
    private final Clock clock;

    // access-ordered: iteration starts at the least recently used entry
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);

    private long hits;
    private long misses;
    private long evictions;

    public LocalLruCacheStore(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public LocalLruCacheStore(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    @Override
    public synchronized <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        if (!type.isInstance(entry.value)) {
            log.warn("Cache entry {} holds {}, expected {}", key,
                    entry.value.getClass().getSimpleName(), type.getSimpleName());
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(type.cast(entry.value));
    }

    @Override
    public synchronized void set(String key, Object value, Duration ttl) {
        Instant expiresAt = ttl != null ? clock.instant().plus(ttl) : null;
        entries.put(key, new Entry(value, expiresAt));

        if (entries.size() > maxEntries) {
            purgeExpired();
        }
        Iterator<Map.Entry<String, Entry>> eldest = entries.entrySet().iterator();
        while (entries.size() > maxEntries && eldest.hasNext()) {
            String evicted = eldest.next().getKey();
            eldest.remove();
            evictions++;
            log.debug("Evicted least recently used cache entry {}", evicted);
        }
    }

    @Override
    public synchronized boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public synchronized boolean exists(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            return false;
        }
        return true;
    }

    @Override
    public synchronized long invalidatePattern(String glob) {
        Pattern pattern = GlobPattern.compile(glob);
        long removed = 0;
        Iterator<String> keys = entries.keySet().iterator();
        while (keys.hasNext()) {
            if (pattern.matcher(keys.next()).matches()) {
                keys.remove();
                removed++;
            }
        }
        log.debug("Invalidated {} local cache entries matching {}", removed, glob);
        return removed;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized CacheHealth health() {
        return CacheHealth.builder()
                .status(CacheStatus.HEALTHY)
                .backend("local")
                .size((long) entries.size())
                .maxSize((long) maxEntries)
                .details(Map.of("hits", hits, "misses", misses, "evictions", evictions))
                .build();
    }

    private void purgeExpired() {
        Instant now = clock.instant();
        entries.values().removeIf(entry -> entry.isExpired(now));
    }

    private static final class Entry {
        private final Object value;
        private final Instant expiresAt;

        private Entry(Object value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}

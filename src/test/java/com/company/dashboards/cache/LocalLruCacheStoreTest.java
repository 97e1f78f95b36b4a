package com.company.dashboards.cache;

import com.company.dashboards.MutableClock;
import com.company.dashboards.domain.enums.CacheStatus;
import com.company.dashboards.dto.response.CacheHealth;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalLruCacheStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));

    @Test
    void returnsExactValueWithinTtl() {
        LocalLruCacheStore store = new LocalLruCacheStore(10, clock);
        List<String> value = List.of("a", "b");

        store.set("k", value, Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(4));

        assertThat(store.get("k", List.class)).containsSame(value);
    }

    @Test
    void expiredEntryIsAbsentAndDropped() {
        LocalLruCacheStore store = new LocalLruCacheStore(10, clock);
        store.set("k", "v", Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(5));

        assertThat(store.get("k", String.class)).isEmpty();
        assertThat(store.exists("k")).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    void nullTtlNeverExpires() {
        LocalLruCacheStore store = new LocalLruCacheStore(10, clock);
        store.set("k", "v", null);

        clock.advance(Duration.ofDays(365));

        assertThat(store.get("k", String.class)).contains("v");
    }

    @Test
    void evictsLeastRecentlyAccessed() {
        LocalLruCacheStore store = new LocalLruCacheStore(3, clock);
        store.set("a", 1, null);
        store.set("b", 2, null);
        store.set("c", 3, null);

        // touch a so b becomes the eldest
        store.get("a", Integer.class);
        store.set("d", 4, null);

        assertThat(store.exists("b")).isFalse();
        assertThat(store.exists("a")).isTrue();
        assertThat(store.exists("c")).isTrue();
        assertThat(store.exists("d")).isTrue();
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    void purgesExpiredBeforeEvictingLiveEntries() {
        LocalLruCacheStore store = new LocalLruCacheStore(2, clock);
        store.set("live", 1, null);
        store.set("short", 2, Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        store.set("new", 3, null);

        assertThat(store.exists("live")).isTrue();
        assertThat(store.exists("new")).isTrue();
        assertThat(store.exists("short")).isFalse();
    }

    @Test
    void overwriteRefreshesValueAndTtl() {
        LocalLruCacheStore store = new LocalLruCacheStore(10, clock);
        store.set("k", "old", Duration.ofMinutes(1));
        clock.advance(Duration.ofSeconds(50));

        store.set("k", "new", Duration.ofMinutes(1));
        clock.advance(Duration.ofSeconds(50));

        assertThat(store.get("k", String.class)).contains("new");
    }

    @Test
    void wrongTypeIsTreatedAsMiss() {
        LocalLruCacheStore store = new LocalLruCacheStore(10, clock);
        store.set("k", "text", null);

        assertThat(store.get("k", Integer.class)).isEmpty();
    }

    @Test
    void invalidatesByGlob() {
        LocalLruCacheStore store = new LocalLruCacheStore(10, clock);
        store.set("dashboard:sales:data:v1", 1, null);
        store.set("dashboard:sales:query:abc:v1", 2, null);
        store.set("dashboard:sales:data:v2", 3, null);
        store.set("dashboard:ops:data:v1", 4, null);

        assertThat(store.invalidatePattern("dashboard:sales:*:v1")).isEqualTo(2);
        assertThat(store.exists("dashboard:sales:data:v2")).isTrue();
        assertThat(store.exists("dashboard:ops:data:v1")).isTrue();
    }

    @Test
    void deleteReportsWhetherKeyExisted() {
        LocalLruCacheStore store = new LocalLruCacheStore(10, clock);
        store.set("k", "v", null);

        assertThat(store.delete("k")).isTrue();
        assertThat(store.delete("k")).isFalse();
    }

    @Test
    void healthReportsSizeAndStats() {
        LocalLruCacheStore store = new LocalLruCacheStore(2, clock);
        store.set("a", 1, null);
        store.get("a", Integer.class);
        store.get("missing", Integer.class);

        CacheHealth health = store.health();

        assertThat(health.getStatus()).isEqualTo(CacheStatus.HEALTHY);
        assertThat(health.getBackend()).isEqualTo("local");
        assertThat(health.getSize()).isEqualTo(1L);
        assertThat(health.getMaxSize()).isEqualTo(2L);
        assertThat(health.getDetails()).containsEntry("hits", 1L).containsEntry("misses", 1L);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new LocalLruCacheStore(0, clock)).isInstanceOf(IllegalArgumentException.class);
    }
}

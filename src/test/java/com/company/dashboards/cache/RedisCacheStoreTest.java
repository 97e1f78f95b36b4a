package com.company.dashboards.cache;

import com.company.dashboards.domain.ChartResult;
import com.company.dashboards.domain.DashboardData;
import com.company.dashboards.domain.enums.CacheStatus;
import com.company.dashboards.domain.enums.ChartType;
import com.company.dashboards.domain.payload.KpiPayload;
import com.company.dashboards.dto.response.CacheHealth;
import com.company.dashboards.exception.CacheUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = RedisCacheStore.cacheObjectMapper();

    private CircuitBreaker circuitBreaker;
    private RedisCacheStore store;

    @BeforeEach
    void setUp() {
        circuitBreaker = CircuitBreaker.ofDefaults("redisCache");
        store = new RedisCacheStore(redisTemplate, objectMapper, circuitBreaker);
    }

    @Test
    void readsBackDashboardPayload() throws Exception {
        DashboardData data = sampleData();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("dashboard:sales:data:v2")).thenReturn(objectMapper.writeValueAsString(data));

        Optional<DashboardData> cached = store.get("dashboard:sales:data:v2", DashboardData.class);

        assertThat(cached).contains(data);
        assertThat(cached.get().getCharts().get("total").getPayload()).isInstanceOf(KpiPayload.class);
    }

    @Test
    void storedNumbersReadBackWithSameTypeAndValue() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        DashboardData data = sampleData(new KpiPayload(
                new BigDecimal("12345678901234567890.123456789"), 42L, BigDecimal.valueOf(0.1), 1));

        store.set("dashboard:sales:data:v2", data, Duration.ofHours(24));
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("dashboard:sales:data:v2"), json.capture(), eq(Duration.ofHours(24)));
        when(valueOperations.get("dashboard:sales:data:v2")).thenReturn(json.getValue());

        DashboardData back = store.get("dashboard:sales:data:v2", DashboardData.class).orElseThrow();

        assertThat(back).isEqualTo(data);
        KpiPayload kpi = (KpiPayload) back.getCharts().get("total").getPayload();
        assertThat(kpi.getValue()).isEqualTo(new BigDecimal("12345678901234567890.123456789"));
        assertThat(kpi.getTrend()).isInstanceOf(Long.class);
    }

    @Test
    void missingKeyIsEmpty() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        assertThat(store.get("absent", DashboardData.class)).isEmpty();
    }

    @Test
    void writesJsonWithTtl() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        DashboardData data = sampleData();

        store.set("dashboard:sales:data:v2", data, Duration.ofHours(24));

        verify(valueOperations).set("dashboard:sales:data:v2",
                objectMapper.writeValueAsString(data), Duration.ofHours(24));
    }

    @Test
    void unreadableEntryIsDiscarded() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("k")).thenReturn("{not json");

        assertThat(store.get("k", DashboardData.class)).isEmpty();
        verify(redisTemplate).delete("k");
    }

    @Test
    void connectionFailureBecomesCacheUnavailable() {
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> store.get("k", DashboardData.class))
                .isInstanceOf(CacheUnavailableException.class)
                .hasMessageContaining("get");
    }

    @Test
    void openBreakerFailsFastWithoutTouchingRedis() {
        circuitBreaker.transitionToOpenState();

        assertThatThrownBy(() -> store.exists("k")).isInstanceOf(CacheUnavailableException.class);
        verifyNoInteractions(redisTemplate);
    }

    @Test
    @SuppressWarnings("unchecked")
    void invalidatesPatternThroughScan() {
        Cursor<String> cursor = mock(Cursor.class);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn("dashboard:sales:data:v1", "dashboard:sales:query:ab:v1");
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(redisTemplate.delete(List.of("dashboard:sales:data:v1", "dashboard:sales:query:ab:v1")))
                .thenReturn(2L);

        assertThat(store.invalidatePattern("dashboard:sales:*:v1")).isEqualTo(2L);
        verify(cursor).close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void healthyWhenPingAnswers() {
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn("PONG");

        CacheHealth health = store.health();

        assertThat(health.getStatus()).isEqualTo(CacheStatus.HEALTHY);
        assertThat(health.getDetails()).containsEntry("circuitBreaker", "CLOSED");
    }

    @Test
    @SuppressWarnings("unchecked")
    void degradedWhenPingFails() {
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenThrow(new RedisConnectionFailureException("refused"));

        CacheHealth health = store.health();

        assertThat(health.getStatus()).isEqualTo(CacheStatus.DEGRADED);
        assertThat(health.getBackend()).isEqualTo("redis");
        assertThat(health.getDetails()).containsKey("error");
    }

    private static DashboardData sampleData() {
        return sampleData(new KpiPayload(1250L, null, null, 1));
    }

    private static DashboardData sampleData(KpiPayload kpi) {
        Map<String, ChartResult> charts = new LinkedHashMap<>();
        charts.put("total", ChartResult.builder()
                .chartId("total")
                .chartType(ChartType.KPI)
                .queryRef("q")
                .payload(kpi)
                .build());
        return DashboardData.builder()
                .dashboardSlug("sales")
                .version(2)
                .computedAt(Instant.parse("2024-03-01T09:00:00Z"))
                .queryCount(1)
                .bytesBilled(10_485_760L)
                .charts(charts)
                .build();
    }
}

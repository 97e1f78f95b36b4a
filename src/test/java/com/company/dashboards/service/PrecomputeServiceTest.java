package com.company.dashboards.service;

import com.company.dashboards.MutableClock;
import com.company.dashboards.TestDashboards;
import com.company.dashboards.cache.CacheKeys;
import com.company.dashboards.cache.CacheLayer;
import com.company.dashboards.cache.LocalLruCacheStore;
import com.company.dashboards.compiler.DashboardCompiler;
import com.company.dashboards.compiler.RegexTableReferenceExtractor;
import com.company.dashboards.config.DashboardProperties;
import com.company.dashboards.domain.DashboardData;
import com.company.dashboards.domain.DashboardDefinition;
import com.company.dashboards.domain.QueryResult;
import com.company.dashboards.domain.enums.QueryPurpose;
import com.company.dashboards.dto.response.BatchPrecomputeResponse;
import com.company.dashboards.dto.response.PrecomputeResponse;
import com.company.dashboards.dto.response.PrecomputeStatusResponse;
import com.company.dashboards.exception.DashboardNotFoundException;
import com.company.dashboards.guardrail.GuardrailExecutor;
import com.company.dashboards.guardrail.GuardrailOutcome;
import com.company.dashboards.guardrail.QueryExecutionRequest;
import com.company.dashboards.repository.DashboardRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PrecomputeServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T06:00:00Z");

    @Mock
    private DashboardRepository dashboardRepository;
    @Mock
    private DashboardPipeline pipeline;
    @Mock
    private GuardrailExecutor guardrailExecutor;

    private final MutableClock clock = new MutableClock(NOW);
    private final DashboardProperties properties = new DashboardProperties();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private LocalLruCacheStore store;
    private PrecomputeService service;

    @BeforeEach
    void setUp() {
        store = new LocalLruCacheStore(100, clock);
        service = new PrecomputeService(dashboardRepository, pipeline,
                new CacheLayer(store, meterRegistry), properties, meterRegistry, clock);
    }

    @Test
    void realPipelineRecomputesOverCachedPayloadAndMarksRefreshed() {
        DashboardDefinition definition = TestDashboards.revenueDashboard();
        when(dashboardRepository.findBySlug(TestDashboards.REVENUE)).thenReturn(Optional.of(definition));
        when(guardrailExecutor.execute(any(QueryExecutionRequest.class))).thenReturn(GuardrailOutcome.success(
                QueryResult.builder()
                        .jobId("job")
                        .rows(List.of(Map.of("month", "2024-01", "revenue", new BigDecimal("100.50"))))
                        .totalRows(1)
                        .bytesBilled(10_485_760L)
                        .build()));
        String key = CacheKeys.dashboardData(TestDashboards.REVENUE, 1);
        store.set(key, DashboardData.builder()
                .dashboardSlug(TestDashboards.REVENUE)
                .version(1)
                .computedAt(NOW.minus(Duration.ofHours(2)))
                .build(), null);
        clock.advance(Duration.ofMinutes(1));

        QueryFanoutExecutor fanoutExecutor = new QueryFanoutExecutor(2);
        try {
            CacheLayer cache = new CacheLayer(store, meterRegistry);
            DashboardPipeline realPipeline = new DashboardPipeline(
                    new DashboardCompiler(new RegexTableReferenceExtractor()), guardrailExecutor,
                    fanoutExecutor, cache, dashboardRepository, properties, meterRegistry, clock);
            PrecomputeService warming = new PrecomputeService(dashboardRepository, realPipeline, cache,
                    properties, meterRegistry, clock);

            PrecomputeResponse response = warming.precompute(TestDashboards.REVENUE);

            assertThat(response.isCachePopulated()).isTrue();
            assertThat(response.getQueriesExecuted()).isEqualTo(2);
        } finally {
            fanoutExecutor.shutdown();
        }

        ArgumentCaptor<QueryExecutionRequest> requests = ArgumentCaptor.forClass(QueryExecutionRequest.class);
        verify(guardrailExecutor, times(2)).execute(requests.capture());
        assertThat(requests.getAllValues()).extracting(QueryExecutionRequest::getPurpose)
                .containsOnly(QueryPurpose.PRECOMPUTE);
        Instant refreshedAt = NOW.plus(Duration.ofMinutes(1));
        assertThat(store.get(key, DashboardData.class)).hasValueSatisfying(data -> {
            assertThat(data.getComputedAt()).isEqualTo(refreshedAt);
            assertThat(data.getCharts()).hasSize(3);
        });
        verify(dashboardRepository).markRefreshed(TestDashboards.REVENUE, refreshedAt);
    }

    @Test
    void precomputeAlwaysRunsPipelineWithPrecomputePurpose() {
        DashboardDefinition definition = TestDashboards.revenueDashboard();
        when(dashboardRepository.findBySlug(TestDashboards.REVENUE)).thenReturn(Optional.of(definition));
        when(pipeline.computeAndStore(definition, QueryPurpose.PRECOMPUTE, PrecomputeService.SYSTEM_ACTOR))
                .thenReturn(pipelineResult(TestDashboards.REVENUE, true, List.of()));

        PrecomputeResponse response = service.precompute(TestDashboards.REVENUE);

        assertThat(response.getDashboardSlug()).isEqualTo(TestDashboards.REVENUE);
        assertThat(response.getVersion()).isEqualTo(1);
        assertThat(response.getQueriesExecuted()).isEqualTo(2);
        assertThat(response.isCachePopulated()).isTrue();
        assertThat(response.getDurationMs()).isEqualTo(840L);
        assertThat(response.getCacheKey()).isEqualTo("dashboard:revenue-dashboard:data:v1");
        assertThat(response.getComputedAt()).isEqualTo(NOW);
        assertThat(meterRegistry.counter("dashboards.precompute.runs", "outcome", "populated").count())
                .isEqualTo(1.0);
    }

    @Test
    void precomputeOfUnknownDashboardFails() {
        when(dashboardRepository.findBySlug("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.precompute("ghost")).isInstanceOf(DashboardNotFoundException.class);
    }

    @Test
    void batchContinuesPastFailures() {
        DashboardDefinition revenue = TestDashboards.revenueDashboard();
        DashboardDefinition partial = revenue.withMetadata(revenue.getMetadata().toBuilder().slug("partial").build());
        when(dashboardRepository.findBySlug(TestDashboards.REVENUE)).thenReturn(Optional.of(revenue));
        when(dashboardRepository.findBySlug("ghost")).thenReturn(Optional.empty());
        when(dashboardRepository.findBySlug("partial")).thenReturn(Optional.of(partial));
        when(pipeline.computeAndStore(eq(revenue), eq(QueryPurpose.PRECOMPUTE), any()))
                .thenReturn(pipelineResult(TestDashboards.REVENUE, true, List.of()));
        when(pipeline.computeAndStore(eq(partial), eq(QueryPurpose.PRECOMPUTE), any()))
                .thenReturn(pipelineResult("partial", false, List.of("top_products_bar")));

        BatchPrecomputeResponse batch = service.precomputeAll(List.of("ghost", TestDashboards.REVENUE, "partial"));

        assertThat(batch.getTotal()).isEqualTo(3);
        assertThat(batch.getSuccessful()).isEqualTo(1);
        assertThat(batch.getFailed()).isEqualTo(2);
        assertThat(batch.getResults()).containsOnlyKeys(TestDashboards.REVENUE, "partial");
        assertThat(batch.getErrors()).containsOnlyKeys("ghost", "partial");
        assertThat(batch.getErrors().get("partial")).contains("top_products_bar");
    }

    @Test
    void statusNeedsRefreshWhenNothingCached() {
        when(dashboardRepository.findBySlug(TestDashboards.REVENUE))
                .thenReturn(Optional.of(TestDashboards.revenueDashboard()));

        PrecomputeStatusResponse status = service.status(TestDashboards.REVENUE);

        assertThat(status.isCached()).isFalse();
        assertThat(status.isNeedsRefresh()).isTrue();
        assertThat(status.getTtlSeconds()).isEqualTo(Duration.ofHours(24).getSeconds());
    }

    @Test
    void statusTracksStalenessAgainstTtl() {
        properties.getCache().setDataTtl(Duration.ofHours(1));
        when(dashboardRepository.findBySlug(TestDashboards.REVENUE))
                .thenReturn(Optional.of(TestDashboards.revenueDashboard()));
        store.set(CacheKeys.dashboardData(TestDashboards.REVENUE, 1),
                DashboardData.builder().dashboardSlug(TestDashboards.REVENUE).version(1).computedAt(NOW).build(),
                null);

        clock.advance(Duration.ofMinutes(30));
        PrecomputeStatusResponse fresh = service.status(TestDashboards.REVENUE);
        clock.advance(Duration.ofMinutes(31));
        PrecomputeStatusResponse stale = service.status(TestDashboards.REVENUE);

        assertThat(fresh.isCached()).isTrue();
        assertThat(fresh.getStalenessSeconds()).isEqualTo(1800L);
        assertThat(fresh.isNeedsRefresh()).isFalse();
        assertThat(stale.isNeedsRefresh()).isTrue();
    }

    @Test
    void actorIsPassedThrough() {
        DashboardDefinition definition = TestDashboards.revenueDashboard();
        when(dashboardRepository.findBySlug(TestDashboards.REVENUE)).thenReturn(Optional.of(definition));
        when(pipeline.computeAndStore(definition, QueryPurpose.PRECOMPUTE, "ops@acme.test"))
                .thenReturn(pipelineResult(TestDashboards.REVENUE, true, List.of()));

        service.precompute(TestDashboards.REVENUE, "ops@acme.test");

        verify(pipeline).computeAndStore(definition, QueryPurpose.PRECOMPUTE, "ops@acme.test");
    }

    private PipelineResult pipelineResult(String slug, boolean stored, List<String> failedCharts) {
        return PipelineResult.builder()
                .data(DashboardData.builder()
                        .dashboardSlug(slug)
                        .version(1)
                        .computedAt(NOW)
                        .queryCount(2)
                        .failedCharts(failedCharts)
                        .build())
                .cacheKey(CacheKeys.dashboardData(slug, 1))
                .cachePopulated(stored)
                .queriesExecuted(2)
                .durationMs(840L)
                .build();
    }
}

package com.company.dashboards.service;

import com.company.dashboards.cache.CacheKeys;
import com.company.dashboards.cache.CacheLayer;
import com.company.dashboards.compiler.DashboardCompiler;
import com.company.dashboards.config.DashboardProperties;
import com.company.dashboards.domain.*;
import com.company.dashboards.domain.enums.ExecutionMode;
import com.company.dashboards.domain.enums.QueryPurpose;
import com.company.dashboards.guardrail.GuardrailError;
import com.company.dashboards.guardrail.GuardrailExecutor;
import com.company.dashboards.guardrail.GuardrailOutcome;
import com.company.dashboards.guardrail.QueryExecutionRequest;
import com.company.dashboards.repository.DashboardRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;

/**
 * The compute half of cache-first serving: plan, fan out, transform, store. Used by both the
 * serving miss path and precompute, which differ only in purpose and in whether the cache is
 * consulted first.
 * <p>
 * A failed query degrades only the charts that depend on it; the failure is recorded on those
 * charts and the combined payload is returned, but a payload with any failed chart is never
 * written to the cache, so the next request retries it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DashboardPipeline {

    private final DashboardCompiler compiler;
    private final GuardrailExecutor guardrailExecutor;
    private final QueryFanoutExecutor fanoutExecutor;
    private final CacheLayer cache;
    private final DashboardRepository dashboardRepository;
    private final DashboardProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // Latest compiled plan per slug, reused only for the exact definition it came from
    private final ConcurrentMap<String, CompiledPlan> compiledPlans = new ConcurrentHashMap<>();

    public ExecutionPlan planFor(DashboardDefinition definition) {
        CompiledPlan current = compiledPlans.get(definition.getSlug());
        if (current != null && current.compiledFrom(definition)) {
            return current.result.getPlan();
        }
        CompilationResult compiled = compiler.compile(definition);
        compiledPlans.put(definition.getSlug(), new CompiledPlan(definition, compiled));
        return compiled.getPlan();
    }

    /**
     * Forgets the compiled plan of a deleted dashboard.
     */
    public void evictPlan(String slug) {
        if (compiledPlans.remove(slug) != null) {
            log.debug("Dropped compiled plan for {}", slug);
        }
    }

    public PipelineResult computeAndStore(DashboardDefinition definition, QueryPurpose purpose, String actor) {
        String slug = definition.getSlug();
        Instant startedAt = clock.instant();
        ExecutionPlan plan = planFor(definition);

        List<Callable<GuardrailOutcome>> tasks = new ArrayList<>();
        for (QueryDescriptor query : plan.getQueries()) {
            QueryExecutionRequest request = QueryExecutionRequest.builder()
                    .sql(query.getSql())
                    .maxBytesBilled(query.getMaxBytesBilled())
                    .mode(ExecutionMode.SERVE)
                    .purpose(purpose)
                    .actor(actor)
                    .dashboardSlug(slug)
                    .build();
            tasks.add(() -> guardrailExecutor.execute(request));
        }

        List<GuardrailOutcome> outcomes = fanoutExecutor.runAll(
                tasks, properties.getServing().getRequestTimeout(), DashboardPipeline::failureOutcome);

        Map<String, GuardrailOutcome> byQuery = new HashMap<>();
        for (int i = 0; i < plan.getQueries().size(); i++) {
            byQuery.put(plan.getQueries().get(i).getQueryId(), outcomes.get(i));
        }

        Instant computedAt = clock.instant();
        DashboardData data = assemble(plan, byQuery, computedAt);
        String cacheKey = CacheKeys.dashboardData(slug, plan.getVersion());

        boolean stored = false;
        if (data.isComplete()) {
            stored = cache.set(cacheKey, data, properties.getCache().getDataTtl());
        } else {
            log.warn("Dashboard {} v{} computed with failed charts {}; result not cached",
                    slug, plan.getVersion(), data.getFailedCharts());
        }
        if (stored) {
            markRefreshed(slug, computedAt);
        }

        long durationMs = Duration.between(startedAt, computedAt).toMillis();
        meterRegistry.timer("dashboards.compute.duration",
                "purpose", purpose.name(),
                "complete", String.valueOf(data.isComplete())
        ).record(Duration.ofMillis(durationMs));

        log.info("Computed dashboard {} v{} in {} ms ({} queries, {} charts, cached: {})",
                slug, plan.getVersion(), durationMs, plan.getTotalQueries(), plan.getTotalCharts(), stored);

        return PipelineResult.builder()
                .data(data)
                .cacheKey(cacheKey)
                .cachePopulated(stored)
                .queriesExecuted(plan.getTotalQueries())
                .durationMs(durationMs)
                .build();
    }

    /**
     * Serve-mode rows for a single query, cached under the per-query key.
     */
    QueryRowsResult fetchQueryRows(DashboardDefinition definition, QueryDescriptor query,
                                   boolean forceRefresh, String actor) {
        String key = CacheKeys.queryResult(definition.getSlug(), query.getQueryHash(), definition.getVersion());
        if (!forceRefresh) {
            Optional<QueryResult> cached = cache.get(key, QueryResult.class);
            if (cached.isPresent()) {
                return QueryRowsResult.cached(cached.get());
            }
        }

        QueryExecutionRequest request = QueryExecutionRequest.builder()
                .sql(query.getSql())
                .maxBytesBilled(query.getMaxBytesBilled())
                .mode(ExecutionMode.SERVE)
                .purpose(QueryPurpose.SERVING)
                .actor(actor)
                .dashboardSlug(definition.getSlug())
                .build();
        List<Callable<GuardrailOutcome>> task = List.of(() -> guardrailExecutor.execute(request));
        GuardrailOutcome outcome = fanoutExecutor.runAll(
                task, properties.getServing().getRequestTimeout(), DashboardPipeline::failureOutcome).get(0);

        if (outcome.isSuccess()) {
            cache.set(key, outcome.getResult(), properties.getCache().getDataTtl());
        }
        return QueryRowsResult.computed(outcome);
    }

    static ChartResult toChartResult(ChartDescriptor chart, GuardrailOutcome outcome) {
        ChartResult.ChartResultBuilder result = ChartResult.builder()
                .chartId(chart.getChartId())
                .chartType(chart.getChartType())
                .queryRef(chart.getQueryRef());

        if (outcome == null) {
            return result.error(new ChartError("QUERY_NOT_FOUND", "No query " + chart.getQueryRef())).build();
        }
        if (!outcome.isSuccess()) {
            GuardrailError error = outcome.getError();
            return result.error(new ChartError(error.getKind().getErrorCode(), error.getMessage())).build();
        }
        try {
            return result.payload(chart.getChartType().transform(outcome.getResult().getRows(), chart.getConfig()))
                    .build();
        } catch (RuntimeException e) {
            log.error("Transform failed for chart {} ({})", chart.getChartId(), chart.getChartType(), e);
            return result.error(new ChartError("TRANSFORM_FAILED", e.getMessage())).build();
        }
    }

    private DashboardData assemble(ExecutionPlan plan, Map<String, GuardrailOutcome> byQuery, Instant computedAt) {
        Map<String, ChartResult> charts = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        for (ChartDescriptor chart : plan.getCharts()) {
            ChartResult result = toChartResult(chart, byQuery.get(chart.getQueryRef()));
            charts.put(chart.getChartId(), result);
            if (result.isFailed()) {
                failed.add(chart.getChartId());
            }
        }

        long bytesBilled = byQuery.values().stream()
                .filter(GuardrailOutcome::isSuccess)
                .mapToLong(outcome -> outcome.getResult().getBytesBilled())
                .sum();

        return DashboardData.builder()
                .dashboardSlug(plan.getDashboardSlug())
                .version(plan.getVersion())
                .computedAt(computedAt)
                .queryCount(plan.getTotalQueries())
                .bytesBilled(bytesBilled)
                .charts(charts)
                .failedCharts(failed)
                .build();
    }

    private void markRefreshed(String slug, Instant computedAt) {
        try {
            dashboardRepository.markRefreshed(slug, computedAt);
        } catch (DataAccessException e) {
            log.warn("Failed to record refresh time for {}: {}", slug, e.getMessage());
        }
    }

    private static GuardrailOutcome failureOutcome(Throwable failure) {
        if (failure instanceof TimeoutException) {
            return GuardrailOutcome.rejected(GuardrailError.engineFailure(failure.getMessage()));
        }
        log.error("Query task failed unexpectedly", failure);
        return GuardrailOutcome.rejected(GuardrailError.engineFailure(
                "Query task failed: " + failure.getMessage()));
    }

    private static final class CompiledPlan {
        private final int version;
        private final List<QueryDefinition> queries;
        private final List<LayoutItem> layout;
        private final CompilationResult result;

        CompiledPlan(DashboardDefinition definition, CompilationResult result) {
            this.version = definition.getVersion();
            this.queries = definition.getQueries();
            this.layout = definition.getLayout();
            this.result = result;
        }

        // A deleted and re-created slug restarts at version 1, so the version alone is not enough
        boolean compiledFrom(DashboardDefinition definition) {
            return version == definition.getVersion()
                    && queries.equals(definition.getQueries())
                    && layout.equals(definition.getLayout());
        }
    }
}

package com.company.dashboards.service;

import com.company.dashboards.cache.CacheKeys;
import com.company.dashboards.cache.CacheLayer;
import com.company.dashboards.config.DashboardProperties;
import com.company.dashboards.domain.DashboardData;
import com.company.dashboards.domain.DashboardDefinition;
import com.company.dashboards.domain.enums.QueryPurpose;
import com.company.dashboards.dto.response.BatchPrecomputeResponse;
import com.company.dashboards.dto.response.PrecomputeResponse;
import com.company.dashboards.dto.response.PrecomputeStatusResponse;
import com.company.dashboards.exception.DashboardNotFoundException;
import com.company.dashboards.repository.DashboardRepository;
import com.company.dashboards.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Out-of-band cache warming. Always recomputes; never reads the cache first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PrecomputeService {

    static final String SYSTEM_ACTOR = "precompute";

    private final DashboardRepository dashboardRepository;
    private final DashboardPipeline pipeline;
    private final CacheLayer cache;
    private final DashboardProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public PrecomputeResponse precompute(String slug) {
        return precompute(slug, SYSTEM_ACTOR);
    }

    public PrecomputeResponse precompute(String slug, String actor) {
        MDC.put(DataServingService.MDC_DASHBOARD, slug);
        try {
            DashboardDefinition definition = dashboardRepository.findBySlug(slug)
                    .orElseThrow(() -> new DashboardNotFoundException(slug));

            log.info("Precomputing dashboard {} v{}", slug, definition.getVersion());
            PipelineResult result = pipeline.computeAndStore(definition, QueryPurpose.PRECOMPUTE, actor);

            meterRegistry.counter("dashboards.precompute.runs",
                    "outcome", result.isCachePopulated() ? "populated" : "not_populated"
            ).increment();

            return PrecomputeResponse.builder()
                    .dashboardSlug(slug)
                    .version(definition.getVersion())
                    .computedAt(result.getData().getComputedAt())
                    .durationMs(result.getDurationMs())
                    .queriesExecuted(result.getQueriesExecuted())
                    .cachePopulated(result.isCachePopulated())
                    .cacheKey(result.getCacheKey())
                    .failedCharts(result.getData().getFailedCharts())
                    .build();
        } finally {
            MDC.remove(DataServingService.MDC_DASHBOARD);
        }
    }

    /**
     * Precomputes each slug in turn. A failing dashboard is recorded and the batch moves on.
     */
    public BatchPrecomputeResponse precomputeAll(List<String> slugs) {
        BatchPrecomputeResponse batch = BatchPrecomputeResponse.builder()
                .total(slugs.size())
                .build();

        for (String slug : slugs) {
            try {
                PrecomputeResponse response = precompute(slug);
                batch.getResults().put(slug, response);
                if (response.isCachePopulated()) {
                    batch.setSuccessful(batch.getSuccessful() + 1);
                } else {
                    batch.setFailed(batch.getFailed() + 1);
                    batch.getErrors().put(slug, "Charts failed: " + response.getFailedCharts());
                }
            } catch (RuntimeException e) {
                log.error("Precompute failed for dashboard {}", slug, e);
                meterRegistry.counter("dashboards.precompute.runs", "outcome", "error").increment();
                batch.setFailed(batch.getFailed() + 1);
                batch.getErrors().put(slug, e.getMessage());
            }
        }

        log.info("Batch precompute finished: {} of {} succeeded, {} failed",
                batch.getSuccessful(), batch.getTotal(), batch.getFailed());
        return batch;
    }

    public PrecomputeStatusResponse status(String slug) {
        DashboardDefinition definition = dashboardRepository.findBySlug(slug)
                .orElseThrow(() -> new DashboardNotFoundException(slug));

        Optional<DashboardData> cached = cache.get(
                CacheKeys.dashboardData(slug, definition.getVersion()), DashboardData.class);
        Instant lastComputed = cached.map(DashboardData::getComputedAt).orElse(null);
        Long staleness = TimeUtils.stalenessSeconds(lastComputed, clock.instant());
        long ttlSeconds = properties.getCache().getDataTtl().getSeconds();

        return PrecomputeStatusResponse.builder()
                .dashboardSlug(slug)
                .version(definition.getVersion())
                .cached(cached.isPresent())
                .lastComputed(lastComputed)
                .stalenessSeconds(staleness)
                .ttlSeconds(ttlSeconds)
                .needsRefresh(staleness == null || staleness > ttlSeconds)
                .build();
    }
}

package com.company.dashboards.service;

import com.company.dashboards.cache.CacheKeys;
import com.company.dashboards.cache.CacheLayer;
import com.company.dashboards.domain.*;
import com.company.dashboards.domain.enums.QueryPurpose;
import com.company.dashboards.dto.response.CacheHealth;
import com.company.dashboards.dto.response.ChartDataResponse;
import com.company.dashboards.dto.response.DashboardDataResponse;
import com.company.dashboards.dto.response.FreshnessResponse;
import com.company.dashboards.event.DashboardAccessedEvent;
import com.company.dashboards.exception.ChartNotFoundException;
import com.company.dashboards.exception.DashboardNotFoundException;
import com.company.dashboards.repository.DashboardRepository;
import com.company.dashboards.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Cache-first read path. A hit returns the stored payload untouched; a miss (or a forced
 * refresh) runs the full pipeline and stores the result under the current version's key.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DataServingService {

    static final String MDC_DASHBOARD = "dashboard";

    private final DashboardRepository dashboardRepository;
    private final DashboardPipeline pipeline;
    private final CacheLayer cache;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public DashboardDataResponse serve(String slug, boolean forceRefresh) {
        return serve(slug, forceRefresh, null);
    }

    public DashboardDataResponse serve(String slug, boolean forceRefresh, String actor) {
        MDC.put(MDC_DASHBOARD, slug);
        try {
            DashboardDefinition definition = loadDefinition(slug);
            String cacheKey = CacheKeys.dashboardData(slug, definition.getVersion());

            if (!forceRefresh) {
                Optional<DashboardData> cached = cache.get(cacheKey, DashboardData.class);
                if (cached.isPresent()) {
                    log.debug("Serving {} v{} from cache", slug, definition.getVersion());
                    eventPublisher.publishEvent(new DashboardAccessedEvent(slug, clock.instant()));
                    return toResponse(definition, cached.get(), true);
                }
            }

            PipelineResult result = pipeline.computeAndStore(definition, QueryPurpose.SERVING, actor);
            return toResponse(definition, result.getData(), false);
        } finally {
            MDC.remove(MDC_DASHBOARD);
        }
    }

    /**
     * Data for a single chart, cached per query rather than per dashboard.
     */
    public ChartDataResponse serveChart(String slug, String chartId, boolean forceRefresh) {
        MDC.put(MDC_DASHBOARD, slug);
        try {
            DashboardDefinition definition = loadDefinition(slug);
            ExecutionPlan plan = pipeline.planFor(definition);
            ChartDescriptor chart = plan.findChart(chartId)
                    .orElseThrow(() -> new ChartNotFoundException(slug, chartId));
            QueryDescriptor query = plan.findQuery(chart.getQueryRef())
                    .orElseThrow(() -> new IllegalStateException(
                            "Chart " + chartId + " references unknown query " + chart.getQueryRef()));

            QueryRowsResult rows = pipeline.fetchQueryRows(definition, query, forceRefresh, null);
            ChartResult chartResult = DashboardPipeline.toChartResult(chart, rows.getOutcome());

            Instant asOf = rows.getOutcome().isSuccess() && rows.getOutcome().getResult().getExecutedAt() != null
                    ? rows.getOutcome().getResult().getExecutedAt()
                    : clock.instant();

            return ChartDataResponse.builder()
                    .dashboardSlug(slug)
                    .version(definition.getVersion())
                    .chartId(chartId)
                    .chart(chartResult)
                    .cacheHit(rows.isCacheHit())
                    .asOf(asOf)
                    .build();
        } finally {
            MDC.remove(MDC_DASHBOARD);
        }
    }

    /**
     * Drops every cached entry of the dashboard, whatever its version.
     */
    public long invalidate(String slug) {
        long removed = cache.invalidatePattern(CacheKeys.dashboardPattern(slug));
        log.info("Invalidated {} cache entries for {}", removed, slug);
        return removed;
    }

    public FreshnessResponse freshness(String slug) {
        DashboardDefinition definition = loadDefinition(slug);
        DashboardMetadata metadata = definition.getMetadata();
        Optional<DashboardData> cached = cache.get(
                CacheKeys.dashboardData(slug, definition.getVersion()), DashboardData.class);

        Instant lastComputed = cached.map(DashboardData::getComputedAt).orElse(null);

        return FreshnessResponse.builder()
                .dashboardSlug(slug)
                .version(definition.getVersion())
                .cached(cached.isPresent())
                .lastComputed(lastComputed)
                .stalenessSeconds(TimeUtils.stalenessSeconds(lastComputed, clock.instant()))
                .lastRefreshedAt(metadata.getLastRefreshedAt())
                .lastAccessedAt(metadata.getLastAccessedAt())
                .accessCount(metadata.getAccessCount())
                .build();
    }

    public CacheHealth cacheHealth() {
        return cache.health();
    }

    private DashboardDefinition loadDefinition(String slug) {
        return dashboardRepository.findBySlug(slug)
                .orElseThrow(() -> new DashboardNotFoundException(slug));
    }

    private DashboardDataResponse toResponse(DashboardDefinition definition, DashboardData data, boolean cacheHit) {
        DashboardMetadata metadata = definition.getMetadata();
        return DashboardDataResponse.builder()
                .dashboardSlug(definition.getSlug())
                .version(definition.getVersion())
                .name(metadata.getName())
                .viewType(metadata.getViewType())
                .payload(data)
                .cacheHit(cacheHit)
                .asOf(data.getComputedAt())
                .lastRefreshedAt(metadata.getLastRefreshedAt())
                .build();
    }
}

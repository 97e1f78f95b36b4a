package com.company.dashboards.service;

import com.company.dashboards.cache.CacheKeys;
import com.company.dashboards.cache.CacheLayer;
import com.company.dashboards.compiler.DashboardCompiler;
import com.company.dashboards.domain.DashboardDefinition;
import com.company.dashboards.dto.response.ExecutionEstimate;
import com.company.dashboards.event.DashboardSavedEvent;
import com.company.dashboards.exception.DashboardNotFoundException;
import com.company.dashboards.repository.DashboardRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class DashboardService {

    private final DashboardRepository dashboardRepository;
    private final DashboardDefinitionValidator validator;
    private final DashboardCompiler compiler;
    private final LineageService lineageService;
    private final DashboardPipeline pipeline;
    private final CacheLayer cache;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Validates and stores {@code definition} as the next version of its slug. Listeners
     * rebuild lineage and drop the previous version's cache entries.
     */
    public DashboardDefinition save(DashboardDefinition definition) {
        validator.validateOrThrow(definition);

        int previousVersion = dashboardRepository.findBySlug(definition.getSlug())
                .map(DashboardDefinition::getVersion)
                .orElse(0);
        DashboardDefinition saved = dashboardRepository.save(definition);

        log.info("Dashboard {} saved: v{} -> v{}", saved.getSlug(), previousVersion, saved.getVersion());
        eventPublisher.publishEvent(new DashboardSavedEvent(saved, previousVersion));
        return saved;
    }

    public DashboardDefinition get(String slug) {
        return dashboardRepository.findBySlug(slug)
                .orElseThrow(() -> new DashboardNotFoundException(slug));
    }

    public List<String> listSlugs() {
        return dashboardRepository.findAllSlugs();
    }

    public ExecutionEstimate estimate(String slug) {
        return compiler.estimateExecutionTime(get(slug));
    }

    public void delete(String slug) {
        if (!dashboardRepository.delete(slug)) {
            throw new DashboardNotFoundException(slug);
        }
        lineageService.deleteLineage(slug);
        pipeline.evictPlan(slug);
        long removed = cache.invalidatePattern(CacheKeys.dashboardPattern(slug));
        log.info("Deleted dashboard {} ({} cache entries dropped)", slug, removed);
    }
}

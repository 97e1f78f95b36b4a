package com.company.dashboards.service;

import com.company.dashboards.event.DashboardSavedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Precomputes a dashboard as soon as a save bumps its version, so the first reader of the new
 * version gets a cache hit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "dashboards.precompute.warm-on-save",
        havingValue = "true"
)
public class CacheWarmingService {

    private final PrecomputeService precomputeService;

    @EventListener
    @Async
    public void onDashboardSaved(DashboardSavedEvent event) {
        String slug = event.getDefinition().getSlug();
        log.info("Warming cache for {} v{}", slug, event.getDefinition().getVersion());
        try {
            precomputeService.precompute(slug);
        } catch (Exception e) {
            log.error("Failed to warm cache for {}", slug, e);
        }
    }
}

package com.company.dashboards.service;

import com.company.dashboards.cache.CacheKeys;
import com.company.dashboards.cache.CacheLayer;
import com.company.dashboards.event.DashboardSavedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Frees the previous version's entries after a save. Correctness does not depend on this:
 * the new version's keys are already different.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CacheEvictionService {

    private final CacheLayer cache;

    @EventListener
    @Async
    public void onDashboardSaved(DashboardSavedEvent event) {
        if (event.getPreviousVersion() < 1) {
            return;
        }
        String slug = event.getDefinition().getSlug();
        long removed = cache.invalidatePattern(CacheKeys.versionPattern(slug, event.getPreviousVersion()));
        log.debug("Evicted {} entries of {} v{}", removed, slug, event.getPreviousVersion());
    }
}

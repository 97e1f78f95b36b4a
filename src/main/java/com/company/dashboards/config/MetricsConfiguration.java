package com.company.dashboards.config;

import com.company.dashboards.cache.CacheStore;
import com.company.dashboards.cache.LocalLruCacheStore;
import com.company.dashboards.repository.DashboardRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;

/**
 * Application-specific gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final DashboardRepository dashboardRepository;
    private final CacheStore cacheStore;

    @Bean
    public MeterBinder dashboardMetrics() {
        return (registry) -> {
            Gauge.builder("dashboards.catalog.size", dashboardRepository, repo -> {
                        try {
                            return repo.count();
                        } catch (DataAccessException e) {
                            log.warn("Failed to count dashboards", e);
                            return 0;
                        }
                    })
                    .description("Number of dashboards in the catalog")
                    .register(registry);

            if (cacheStore instanceof LocalLruCacheStore) {
                Gauge.builder("dashboards.cache.entries", (LocalLruCacheStore) cacheStore, LocalLruCacheStore::size)
                        .description("Entries held by the local cache")
                        .register(registry);
            }

            log.info("Dashboard metrics registered");
        };
    }
}

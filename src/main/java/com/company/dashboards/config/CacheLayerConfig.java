package com.company.dashboards.config;

import com.company.dashboards.cache.CacheStore;
import com.company.dashboards.cache.LocalLruCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * In-process LRU backend, the default. {@link RedisCacheConfig} supplies the shared backend
 * when {@code dashboards.cache.type=redis}.
 */
@Configuration
@Slf4j
public class CacheLayerConfig {

    @Bean
    @ConditionalOnProperty(value = "dashboards.cache.type", havingValue = "local", matchIfMissing = true)
    public CacheStore localCacheStore(DashboardProperties properties, Clock clock) {
        int maxEntries = properties.getCache().getMaxEntries();
        log.info("Using local LRU cache with {} entries", maxEntries);
        return new LocalLruCacheStore(maxEntries, clock);
    }
}

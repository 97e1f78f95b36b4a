package com.company.dashboards.health;

import com.company.dashboards.cache.CacheLayer;
import com.company.dashboards.dto.response.CacheHealth;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Reports the cache as DEGRADED, never DOWN: serving keeps working without it.
 */
@Component("dashboardCache")
@RequiredArgsConstructor
public class CacheHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Serving without cache");

    private final CacheLayer cache;

    @Override
    public Health health() {
        CacheHealth health = cache.health();
        Health.Builder builder = health.isHealthy() ? Health.up() : Health.status(DEGRADED);
        builder.withDetail("backend", health.getBackend());
        if (health.getSize() != null) {
            builder.withDetail("size", health.getSize());
        }
        if (health.getMaxSize() != null) {
            builder.withDetail("maxSize", health.getMaxSize());
        }
        if (health.getDetails() != null) {
            builder.withDetails(health.getDetails());
        }
        return builder.build();
    }
}

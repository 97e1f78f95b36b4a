package com.company.dashboards.health;

import com.company.dashboards.engine.QueryEngineClient;
import com.company.dashboards.exception.EngineException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Dry-runs a constant query; dry runs are free, so this is safe to poll.
 */
@Component("queryEngine")
@RequiredArgsConstructor
public class QueryEngineHealthIndicator implements HealthIndicator {

    static final String PROBE_SQL = "SELECT 1";

    private final QueryEngineClient engine;

    @Override
    public Health health() {
        try {
            long bytes = engine.dryRun(PROBE_SQL);
            return Health.up()
                    .withDetail("engine", engine.engineName())
                    .withDetail("probeBytes", bytes)
                    .build();
        } catch (EngineException e) {
            return Health.down(e)
                    .withDetail("engine", engine.engineName())
                    .withDetail("reason", e.getReason().name())
                    .build();
        }
    }
}

package com.company.dashboards.guardrail;

import com.company.dashboards.config.DashboardProperties;
import com.company.dashboards.domain.QueryLogEntry;
import com.company.dashboards.repository.QueryLogRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes cost-attribution records. A failed write is counted and logged, never rethrown:
 * losing a log row must not fail the query it describes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QueryCostLogger {

    private final QueryLogRepository queryLogRepository;
    private final DashboardProperties properties;
    private final MeterRegistry meterRegistry;

    public void record(QueryLogEntry entry) {
        if (!properties.getQueryLog().isEnabled()) {
            return;
        }
        try {
            queryLogRepository.insert(entry);
        } catch (Exception e) {
            meterRegistry.counter("dashboards.query.log.failures").increment();
            log.error("Failed to record query log for hash {} (purpose {})",
                    entry.getQueryHash(), entry.getPurpose(), e);
        }
    }
}

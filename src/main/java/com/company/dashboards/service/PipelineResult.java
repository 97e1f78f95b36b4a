package com.company.dashboards.service;

import com.company.dashboards.domain.DashboardData;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one forced computation of a dashboard.
 */
@Value
@Builder
public class PipelineResult {
    DashboardData data;
    String cacheKey;
    boolean cachePopulated;
    int queriesExecuted;
    long durationMs;
}

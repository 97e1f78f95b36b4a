package com.company.dashboards.domain;

import com.company.dashboards.domain.enums.ExecutionStrategy;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * Ready-to-run form of a dashboard version. Derived on demand, never persisted.
 */
@Value
@Builder
@Jacksonized
public class ExecutionPlan {
    String dashboardSlug;
    int version;
    List<QueryDescriptor> queries;
    List<ChartDescriptor> charts;
    @Builder.Default
    ExecutionStrategy executionStrategy = ExecutionStrategy.PARALLEL;
    int totalQueries;
    int totalCharts;

    public Optional<ChartDescriptor> findChart(String chartId) {
        return charts.stream().filter(c -> c.getChartId().equals(chartId)).findFirst();
    }

    public Optional<QueryDescriptor> findQuery(String queryId) {
        return queries.stream().filter(q -> q.getQueryId().equals(queryId)).findFirst();
    }
}

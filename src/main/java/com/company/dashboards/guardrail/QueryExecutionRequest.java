package com.company.dashboards.guardrail;

import com.company.dashboards.domain.enums.ExecutionMode;
import com.company.dashboards.domain.enums.QueryPurpose;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryExecutionRequest {
    String sql;
    /** Per-query cap; null falls back to the configured default. */
    Long maxBytesBilled;
    @Builder.Default
    ExecutionMode mode = ExecutionMode.SERVE;
    @Builder.Default
    QueryPurpose purpose = QueryPurpose.SERVING;
    String actor;
    String dashboardSlug;
}

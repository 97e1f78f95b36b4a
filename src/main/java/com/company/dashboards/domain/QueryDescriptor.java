package com.company.dashboards.domain;

import com.company.dashboards.domain.enums.Warehouse;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class QueryDescriptor {
    String queryId;
    String queryHash;
    Warehouse warehouse;
    String sql;
    Long maxBytesBilled;
    List<String> dependentCharts;
    int executionOrder;
}

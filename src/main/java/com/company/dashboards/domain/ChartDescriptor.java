package com.company.dashboards.domain;

import com.company.dashboards.domain.enums.ChartType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class ChartDescriptor {
    String chartId;
    ChartType chartType;
    String queryRef;
    GridPosition position;
    Map<String, Object> config;
}

package com.company.dashboards.dto.response;

import lombok.*;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrecomputeResponse {
    private String dashboardSlug;
    private int version;
    private Instant computedAt;
    private long durationMs;
    private int queriesExecuted;
    private boolean cachePopulated;
    private String cacheKey;
    private List<String> failedCharts;
}

package com.company.dashboards.dto.response;

import lombok.*;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryCostSummary {
    private Instant since;
    private long queryCount;
    private long failedCount;
    private long cacheHitCount;
    private long bytesBilled;
    private double estimatedCostUsd;
}

package com.company.dashboards.dto.response;

import lombok.*;
import com.company.dashboards.domain.ChartResult;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChartDataResponse {
    private String dashboardSlug;
    private int version;
    private String chartId;
    private ChartResult chart;
    private boolean cacheHit;
    private Instant asOf;
}

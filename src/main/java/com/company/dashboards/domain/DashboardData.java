package com.company.dashboards.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combined chart payloads for one dashboard version, as stored under
 * {@code dashboard:{slug}:data:v{version}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(value = "complete", allowGetters = true)
public class DashboardData implements Serializable {
    private static final long serialVersionUID = 1L;

    private String dashboardSlug;
    private int version;
    private Instant computedAt;
    private int queryCount;
    private long bytesBilled;
    @Builder.Default
    private Map<String, ChartResult> charts = new LinkedHashMap<>();
    @Builder.Default
    private List<String> failedCharts = new ArrayList<>();

    public boolean isComplete() {
        return failedCharts.isEmpty();
    }
}

package com.company.dashboards.domain;

import com.company.dashboards.domain.enums.QueryPurpose;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cost-attribution record written for every guarded execution, successful or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryLogEntry {
    private Long id;
    private String queryHash;
    private String sqlPreview;
    private long bytesScanned;
    private long bytesBilled;
    private long durationMs;
    private long rowCount;
    private String jobId;
    private boolean cacheHit;
    private QueryPurpose purpose;
    private String actor;
    private String dashboardSlug;
    private String errorCode;
    private Instant executedAt;
}

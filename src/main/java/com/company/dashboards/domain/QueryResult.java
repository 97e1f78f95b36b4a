package com.company.dashboards.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rows and execution metadata of one guarded query run. In verify mode {@code rows}
 * holds a sample and {@code totalRows} still reports the full count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult implements Serializable {
    private static final long serialVersionUID = 1L;

    private String jobId;
    private String queryHash;
    @Builder.Default
    private List<SchemaField> schema = new ArrayList<>();
    @Builder.Default
    private List<Map<String, Object>> rows = new ArrayList<>();
    private long totalRows;
    private long bytesScanned;
    private long bytesBilled;
    private boolean cacheHit;
    private long durationMs;
    private boolean sampled;
    private double estimatedCostUsd;
    private Instant executedAt;
}

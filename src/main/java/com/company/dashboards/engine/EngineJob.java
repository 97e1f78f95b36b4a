package com.company.dashboards.engine;

import com.company.dashboards.domain.SchemaField;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A finished engine job with its (possibly limited) rows and billing statistics.
 */
@Value
@Builder
public class EngineJob {
    String jobId;
    List<SchemaField> schema;
    List<Map<String, Object>> rows;
    long totalRows;
    long bytesProcessed;
    long bytesBilled;
    boolean cacheHit;
    long durationMs;
}

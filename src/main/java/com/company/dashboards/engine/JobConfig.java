package com.company.dashboards.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class JobConfig {
    /** Hard cap enforced by the engine; the job fails rather than truncating. */
    long maximumBytesBilled;
    boolean useQueryCache;
    Duration timeout;
    /** Rows to return to the caller, 0 for all. {@link EngineJob#getTotalRows()} is unaffected. */
    int maxRows;
}

package com.company.dashboards.dto.response;

import lombok.*;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrecomputeStatusResponse {
    private String dashboardSlug;
    private int version;
    private boolean cached;
    private Instant lastComputed;
    private Long stalenessSeconds;
    private long ttlSeconds;
    private boolean needsRefresh;
}

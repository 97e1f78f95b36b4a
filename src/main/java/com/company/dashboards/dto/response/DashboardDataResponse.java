package com.company.dashboards.dto.response;

import lombok.*;
import com.company.dashboards.domain.DashboardData;
import com.company.dashboards.domain.enums.ViewType;

import java.io.Serializable;
import java.time.Instant;

/**
 * Result of a serve call. {@code asOf} is when the payload was computed, which for a cache
 * hit can be well before the request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardDataResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private String dashboardSlug;
    private int version;
    private String name;
    private ViewType viewType;
    private DashboardData payload;
    private boolean cacheHit;
    private Instant asOf;
    private Instant lastRefreshedAt;
}

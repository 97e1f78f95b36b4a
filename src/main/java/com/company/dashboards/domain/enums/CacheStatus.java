package com.company.dashboards.domain.enums;

public enum CacheStatus {
    HEALTHY,
    DEGRADED
}

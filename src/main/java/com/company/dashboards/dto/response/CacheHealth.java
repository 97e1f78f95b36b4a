package com.company.dashboards.dto.response;

import lombok.*;
import com.company.dashboards.domain.enums.CacheStatus;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheHealth {
    private CacheStatus status;
    private String backend;
    private Long size;
    private Long maxSize;
    private Map<String, Object> details;

    public boolean isHealthy() {
        return status == CacheStatus.HEALTHY;
    }
}

package com.company.dashboards.dto.response;

import lombok.*;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionEstimate {
    private String dashboardSlug;
    private int version;
    private Map<String, Long> perQueryMs;
    private long estimatedMs;
}

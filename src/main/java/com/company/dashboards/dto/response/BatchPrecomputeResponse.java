package com.company.dashboards.dto.response;

import lombok.*;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchPrecomputeResponse {
    private int total;
    private int successful;
    private int failed;
    @Builder.Default
    private Map<String, PrecomputeResponse> results = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, String> errors = new LinkedHashMap<>();
}

package com.company.dashboards.domain;

import com.company.dashboards.domain.enums.ChartType;
import com.company.dashboards.domain.payload.ChartPayload;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * One chart inside a dashboard payload. Exactly one of {@code payload} and {@code error} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChartResult implements Serializable {
    private static final long serialVersionUID = 1L;

    private String chartId;
    private ChartType chartType;
    private String queryRef;
    private ChartPayload payload;
    private ChartError error;

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}

package com.company.dashboards.domain.payload;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class KpiPayload extends ChartPayload {
    private static final long serialVersionUID = 1L;

    private Object value;
    private Object trend;
    private Object comparison;

    public KpiPayload(Object value, Object trend, Object comparison, int rowCount) {
        super(rowCount);
        this.value = value;
        this.trend = trend;
        this.comparison = comparison;
    }
}

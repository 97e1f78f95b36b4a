package com.company.dashboards.domain.payload;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Label to value, in row order.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CategoricalPayload extends ChartPayload {
    private static final long serialVersionUID = 1L;

    private Map<String, Object> data = new LinkedHashMap<>();

    public CategoricalPayload(Map<String, Object> data, int rowCount) {
        super(rowCount);
        this.data = data;
    }
}

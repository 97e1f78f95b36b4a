package com.company.dashboards.domain.payload;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered {@code [x, y]} pairs.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TimeSeriesPayload extends ChartPayload {
    private static final long serialVersionUID = 1L;

    private List<List<Object>> data = new ArrayList<>();

    public TimeSeriesPayload(List<List<Object>> data) {
        super(data.size());
        this.data = data;
    }
}

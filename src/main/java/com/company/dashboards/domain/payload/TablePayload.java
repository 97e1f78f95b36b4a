package com.company.dashboards.domain.payload;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TablePayload extends ChartPayload {
    private static final long serialVersionUID = 1L;

    private List<Map<String, Object>> data = new ArrayList<>();
    private List<String> columns = new ArrayList<>();

    public TablePayload(List<Map<String, Object>> data, List<String> columns) {
        super(data.size());
        this.data = data;
        this.columns = columns;
    }
}

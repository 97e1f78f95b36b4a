package com.company.dashboards.domain.payload;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Compact, render-ready result for one chart. The {@code format} property tells the
 * front end which shape to expect.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "format")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TimeSeriesPayload.class, name = "time_series"),
        @JsonSubTypes.Type(value = CategoricalPayload.class, name = "categorical"),
        @JsonSubTypes.Type(value = KpiPayload.class, name = "kpi"),
        @JsonSubTypes.Type(value = TablePayload.class, name = "table")
})
public abstract class ChartPayload implements Serializable {
    private static final long serialVersionUID = 1L;

    private int rowCount;
}

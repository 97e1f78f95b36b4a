package com.company.dashboards.domain;

import com.company.dashboards.domain.enums.ChartType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.Map;

/**
 * One chart on the dashboard grid, bound to a query by id.
 */
@Value
@Builder
@Jacksonized
public class LayoutItem implements Serializable {
    private static final long serialVersionUID = 1L;

    String id;
    ChartType type;
    String queryRef;
    GridPosition position;

    @Singular("configEntry")
    Map<String, Object> config;

    @JsonIgnore
    public String getTitle() {
        Object title = config.get("title");
        return title != null ? title.toString() : id;
    }
}

package com.company.dashboards.domain;

import com.company.dashboards.domain.enums.Warehouse;
import com.company.dashboards.util.QueryHasher;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

@Value
@Builder
@Jacksonized
public class QueryDefinition implements Serializable {
    private static final long serialVersionUID = 1L;

    String id;
    @Builder.Default
    Warehouse warehouse = Warehouse.BIGQUERY;
    String sql;

    /** Per-query byte-billing override; null means the global default applies. */
    Long maxBytesBilled;

    @JsonIgnore
    public String getQueryHash() {
        return QueryHasher.hash(sql);
    }
}

package com.company.dashboards.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Validated, immutable description of a dashboard: its metadata, queries and chart layout.
 * A new version is always a new instance (see {@link #withVersion(int)}).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DashboardDefinition implements Serializable {
    private static final long serialVersionUID = 1L;

    DashboardMetadata metadata;
    @Singular
    List<QueryDefinition> queries;
    @Singular("layoutItem")
    List<LayoutItem> layout;

    @JsonIgnore
    public String getSlug() {
        return metadata.getSlug();
    }

    @JsonIgnore
    public int getVersion() {
        return metadata.getVersion();
    }

    public Optional<QueryDefinition> findQuery(String queryId) {
        return queries.stream().filter(q -> q.getId().equals(queryId)).findFirst();
    }

    public DashboardDefinition withVersion(int version) {
        return toBuilder()
                .metadata(metadata.toBuilder().version(version).build())
                .build();
    }

    public DashboardDefinition withMetadata(DashboardMetadata metadata) {
        return toBuilder().metadata(metadata).build();
    }
}

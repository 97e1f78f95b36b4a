package com.company.dashboards.domain;

import com.company.dashboards.domain.enums.ViewType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class DashboardMetadata implements Serializable {
    private static final long serialVersionUID = 1L;

    String slug;
    String name;
    String description;
    String owner;
    @Builder.Default
    ViewType viewType = ViewType.ANALYTICAL;
    @Singular
    List<String> tags;
    @Builder.Default
    int version = 1;

    Instant createdAt;
    Instant updatedAt;

    // Access and freshness stats, maintained by the catalog rather than the definition author
    Instant lastAccessedAt;
    Instant lastRefreshedAt;
    long accessCount;
}

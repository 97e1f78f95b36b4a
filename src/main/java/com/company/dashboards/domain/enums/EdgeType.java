package com.company.dashboards.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EdgeType {
    CONTAINS("dashboard contains chart"),
    EXECUTES("chart executes query"),
    READS_FROM("query reads from table");

    private final String description;

    EdgeType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EdgeType fromString(String value) {
        return EdgeType.valueOf(value.toUpperCase(Locale.ROOT));
    }
}

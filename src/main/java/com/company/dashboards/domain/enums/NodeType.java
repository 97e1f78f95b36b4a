package com.company.dashboards.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeType {
    DASHBOARD,
    CHART,
    QUERY,
    TABLE;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeType fromString(String value) {
        return NodeType.valueOf(value.toUpperCase(Locale.ROOT));
    }
}

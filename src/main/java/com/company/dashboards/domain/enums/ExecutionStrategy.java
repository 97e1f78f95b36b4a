package com.company.dashboards.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionStrategy {
    PARALLEL;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

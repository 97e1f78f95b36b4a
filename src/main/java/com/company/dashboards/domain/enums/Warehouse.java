package com.company.dashboards.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Query engines a dashboard query can target. Only one engine is wired today.
 */
public enum Warehouse {
    BIGQUERY("bigquery");

    private final String wireName;

    Warehouse(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Warehouse fromString(String value) {
        for (Warehouse warehouse : values()) {
            if (warehouse.wireName.equalsIgnoreCase(value) || warehouse.name().equalsIgnoreCase(value)) {
                return warehouse;
            }
        }
        throw new IllegalArgumentException("Unsupported warehouse: " + value);
    }
}

package com.company.dashboards.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ViewType {
    ANALYTICAL("analytical"),
    OPERATIONAL("operational"),
    STRATEGIC("strategic");

    private final String wireName;

    ViewType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ViewType fromString(String value) {
        if (value == null) {
            return ANALYTICAL;
        }
        for (ViewType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return ANALYTICAL;
    }
}

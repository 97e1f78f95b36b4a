package com.company.dashboards.domain.enums;

import java.util.Locale;

public enum QueryPurpose {
    VERIFICATION,
    SERVING,
    PRECOMPUTE;

    public static QueryPurpose fromString(String purpose) {
        if (purpose == null) {
            return SERVING;
        }
        try {
            return QueryPurpose.valueOf(purpose.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return SERVING;
        }
    }
}

package com.company.dashboards.util;

public final class SqlUtils {

    public static final int LINEAGE_PREVIEW_LENGTH = 200;
    public static final int LOG_PREVIEW_LENGTH = 500;

    private SqlUtils() {
    }

    public static String preview(String sql, int maxLength) {
        if (sql == null) {
            return null;
        }
        return sql.length() <= maxLength ? sql : sql.substring(0, maxLength);
    }
}

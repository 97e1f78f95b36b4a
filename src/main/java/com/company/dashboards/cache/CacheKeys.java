package com.company.dashboards.cache;

/**
 * Key scheme shared by every process that reads or writes the cache. The dashboard version
 * is part of each data key, so saving a new version orphans all older entries.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String dashboardData(String slug, int version) {
        return "dashboard:" + slug + ":data:v" + version;
    }

    public static String queryResult(String slug, String queryHash, int version) {
        return "dashboard:" + slug + ":query:" + queryHash + ":v" + version;
    }

    public static String lineage(String slug) {
        return "lineage:" + slug;
    }

    public static String dashboardPattern(String slug) {
        return "dashboard:" + slug + ":*";
    }

    /**
     * Every data and query key of one version of a dashboard.
     */
    public static String versionPattern(String slug, int version) {
        return "dashboard:" + slug + ":*:v" + version;
    }
}

package com.company.dashboards.util;

public final class CostUtils {

    public static final double USD_PER_TIB = 5.0;
    private static final double BYTES_PER_TIB = 1024.0 * 1024 * 1024 * 1024;

    private CostUtils() {
    }

    /**
     * On-demand price of the given billed bytes.
     */
    public static double estimateCostUsd(long bytesBilled) {
        return bytesBilled / BYTES_PER_TIB * USD_PER_TIB;
    }
}

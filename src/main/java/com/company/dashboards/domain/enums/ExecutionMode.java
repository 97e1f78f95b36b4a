package com.company.dashboards.domain.enums;

public enum ExecutionMode {
    /** Schema inspection: returns at most {@link #VERIFY_SAMPLE_ROWS} rows. */
    VERIFY,
    /** Chart rendering: returns the complete row set. */
    SERVE;

    public static final int VERIFY_SAMPLE_ROWS = 100;

    public int rowLimit() {
        return this == VERIFY ? VERIFY_SAMPLE_ROWS : 0;
    }
}

package com.company.dashboards.exception;

public class ChartNotFoundException extends RuntimeException {
    public ChartNotFoundException(String slug, String chartId) {
        super("Chart " + chartId + " not found in dashboard " + slug);
    }
}

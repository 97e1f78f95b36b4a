package com.company.dashboards.exception;

public class LineageNotFoundException extends RuntimeException {
    public LineageNotFoundException(String slug) {
        super("No lineage recorded for dashboard: " + slug);
    }
}

package com.company.dashboards.exception;

public class DashboardNotFoundException extends RuntimeException {
    public DashboardNotFoundException(String slug) {
        super("Dashboard not found: " + slug);
    }
}

package com.company.dashboards.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class DashboardAccessedEvent {
    private final String slug;
    private final Instant accessedAt;
}

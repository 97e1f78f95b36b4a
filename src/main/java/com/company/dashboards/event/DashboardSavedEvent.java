package com.company.dashboards.event;

import com.company.dashboards.domain.DashboardDefinition;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DashboardSavedEvent {
    private final DashboardDefinition definition;
    /** 0 when the dashboard did not exist before this save. */
    private final int previousVersion;
}

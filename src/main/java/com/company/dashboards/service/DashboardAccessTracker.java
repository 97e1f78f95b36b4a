package com.company.dashboards.service;

import com.company.dashboards.event.DashboardAccessedEvent;
import com.company.dashboards.repository.DashboardRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Access stats are written off the request thread so a cache hit never waits on the database.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DashboardAccessTracker {

    private final DashboardRepository dashboardRepository;

    @EventListener
    @Async
    public void onDashboardAccessed(DashboardAccessedEvent event) {
        try {
            dashboardRepository.recordAccess(event.getSlug(), event.getAccessedAt());
        } catch (DataAccessException e) {
            log.warn("Failed to record access for {}: {}", event.getSlug(), e.getMessage());
        }
    }
}

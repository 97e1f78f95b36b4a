package com.company.dashboards.service;

import com.company.dashboards.domain.QueryLogEntry;
import com.company.dashboards.dto.response.QueryCostSummary;
import com.company.dashboards.repository.QueryLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Read side of the query-cost log.
 */
@Service
@RequiredArgsConstructor
public class QueryCostService {

    private static final int MAX_RECENT = 500;

    private final QueryLogRepository queryLogRepository;
    private final Clock clock;

    public QueryCostSummary summarizeLast(Duration window) {
        return queryLogRepository.summarizeSince(clock.instant().minus(window));
    }

    public List<QueryLogEntry> recentForDashboard(String slug, int limit) {
        return queryLogRepository.findRecentByDashboard(slug, Math.min(Math.max(limit, 1), MAX_RECENT));
    }
}

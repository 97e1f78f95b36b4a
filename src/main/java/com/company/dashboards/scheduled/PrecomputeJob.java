package com.company.dashboards.scheduled;

import com.company.dashboards.config.DashboardProperties;
import com.company.dashboards.dto.response.BatchPrecomputeResponse;
import com.company.dashboards.repository.DashboardRepository;
import com.company.dashboards.service.PrecomputeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "dashboards.precompute.scheduled",
        havingValue = "true"
)
public class PrecomputeJob {

    private final PrecomputeService precomputeService;
    private final DashboardRepository dashboardRepository;
    private final DashboardProperties properties;

    /**
     * Warms the configured dashboards, or the whole catalog when none are configured.
     */
    @Scheduled(cron = "${dashboards.precompute.cron:0 0 * * * *}")
    public void warmDashboards() {
        List<String> slugs = properties.getPrecompute().getSlugs().isEmpty()
                ? dashboardRepository.findAllSlugs()
                : properties.getPrecompute().getSlugs();

        log.info("Starting scheduled precompute for {} dashboards", slugs.size());
        BatchPrecomputeResponse batch = precomputeService.precomputeAll(slugs);

        if (batch.getFailed() > 0) {
            log.warn("Scheduled precompute failed for {}", batch.getErrors().keySet());
        }
    }
}

package com.company.dashboards.scheduled;

import com.company.dashboards.dto.response.BatchPrecomputeResponse;
import com.company.dashboards.dto.response.QueryCostSummary;
import com.company.dashboards.service.PrecomputeService;
import com.company.dashboards.service.QueryCostService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Operator trigger: {@code --precompute=sales-overview,revenue-dashboard} warms the named
 * dashboards once the context is up, then reports what the run billed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PrecomputeCommandRunner implements ApplicationRunner {

    static final String OPTION = "precompute";
    static final int FAILED_QUERIES_SHOWN = 5;

    private final PrecomputeService precomputeService;
    private final QueryCostService queryCostService;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION)) {
            return;
        }
        List<String> slugs = args.getOptionValues(OPTION).stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(slug -> !slug.isEmpty())
                .distinct()
                .collect(Collectors.toList());

        if (slugs.isEmpty()) {
            log.warn("--{} given without any dashboard slug", OPTION);
            return;
        }

        Instant startedAt = clock.instant();
        BatchPrecomputeResponse batch = precomputeService.precomputeAll(slugs);
        batch.getResults().forEach((slug, result) -> log.info("{}: {} queries in {} ms, cached: {}",
                slug, result.getQueriesExecuted(), result.getDurationMs(), result.isCachePopulated()));
        batch.getErrors().forEach((slug, error) -> {
            log.error("{}: {}", slug, error);
            reportFailedQueries(slug);
        });

        reportCost(Duration.between(startedAt, clock.instant()));
    }

    private void reportFailedQueries(String slug) {
        try {
            queryCostService.recentForDashboard(slug, FAILED_QUERIES_SHOWN).stream()
                    .filter(entry -> entry.getErrorCode() != null)
                    .forEach(entry -> log.error("  query {} failed with {}: {}",
                            entry.getQueryHash(), entry.getErrorCode(), entry.getSqlPreview()));
        } catch (DataAccessException e) {
            log.warn("Query log unavailable for {}: {}", slug, e.getMessage());
        }
    }

    private void reportCost(Duration elapsed) {
        try {
            // Rounded up so queries logged in the run's last partial second are included
            QueryCostSummary cost = queryCostService.summarizeLast(elapsed.plusSeconds(1));
            log.info("Precompute run: {} queries ({} failed, {} cache hits), {} bytes billed, ~${}",
                    cost.getQueryCount(), cost.getFailedCount(), cost.getCacheHitCount(),
                    cost.getBytesBilled(), String.format(Locale.ROOT, "%.4f", cost.getEstimatedCostUsd()));
        } catch (DataAccessException e) {
            log.warn("Query log unavailable, cost of the run not reported: {}", e.getMessage());
        }
    }
}

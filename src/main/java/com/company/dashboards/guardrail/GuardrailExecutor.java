package com.company.dashboards.guardrail;

import com.company.dashboards.config.DashboardProperties;
import com.company.dashboards.domain.QueryLogEntry;
import com.company.dashboards.domain.QueryResult;
import com.company.dashboards.domain.enums.ExecutionMode;
import com.company.dashboards.domain.enums.QueryPurpose;
import com.company.dashboards.engine.EngineJob;
import com.company.dashboards.engine.JobConfig;
import com.company.dashboards.engine.QueryEngineClient;
import com.company.dashboards.exception.EngineException;
import com.company.dashboards.util.CostUtils;
import com.company.dashboards.util.QueryHasher;
import com.company.dashboards.util.SqlUtils;
import com.company.dashboards.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs SQL against the query engine behind three guards, in order: forbidden keywords,
 * dataset allowlist, byte cap. The cap is checked against a dry-run estimate first and is
 * also handed to the engine, which aborts the job rather than return a truncated result.
 * <p>
 * Every attempt, including rejections, produces one query log record.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GuardrailExecutor {

    private final QueryEngineClient engine;
    private final SqlGuard sqlGuard;
    private final QueryCostLogger costLogger;
    private final DashboardProperties properties;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;
    private final Clock clock;

    public GuardrailOutcome execute(String sql, Long byteCap, ExecutionMode mode) {
        return execute(QueryExecutionRequest.builder()
                .sql(sql)
                .maxBytesBilled(byteCap)
                .mode(mode)
                .purpose(mode == ExecutionMode.VERIFY ? QueryPurpose.VERIFICATION : QueryPurpose.SERVING)
                .build());
    }

    /**
     * Runs a query in verify mode and returns a sample of at most 100 rows.
     */
    public GuardrailOutcome verify(String sql, String actor) {
        return execute(QueryExecutionRequest.builder()
                .sql(sql)
                .mode(ExecutionMode.VERIFY)
                .purpose(QueryPurpose.VERIFICATION)
                .actor(actor)
                .build());
    }

    public GuardrailOutcome execute(QueryExecutionRequest request) {
        String sql = request.getSql();
        String queryHash = QueryHasher.hash(sql);
        long byteCap = effectiveCap(request.getMaxBytesBilled());
        Instant startedAt = clock.instant();

        Optional<GuardrailError> rejection = sqlGuard.check(sql);
        if (rejection.isPresent()) {
            return reject(request, queryHash, startedAt, rejection.get());
        }

        long estimatedBytes;
        try {
            estimatedBytes = engine.dryRun(sql);
        } catch (EngineException e) {
            return reject(request, queryHash, startedAt, translate(e, byteCap, null));
        }
        if (estimatedBytes > byteCap) {
            return reject(request, queryHash, startedAt,
                    GuardrailError.bytesLimitExceeded(estimatedBytes, byteCap));
        }

        Span span = tracer.spanBuilder("guardrail.query.execute")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("query.hash", queryHash);
            span.setAttribute("query.mode", request.getMode().name());
            span.setAttribute("query.purpose", request.getPurpose().name());
            span.setAttribute("query.bytes_cap", byteCap);
            span.setAttribute("query.bytes_estimated", estimatedBytes);
            if (request.getDashboardSlug() != null) {
                span.setAttribute("dashboard.slug", request.getDashboardSlug());
            }

            EngineJob job = engine.execute(sql, JobConfig.builder()
                    .maximumBytesBilled(byteCap)
                    .useQueryCache(properties.getEngine().isUseQueryCache())
                    .timeout(properties.getEngine().getQueryTimeout())
                    .maxRows(request.getMode().rowLimit())
                    .build());

            QueryResult result = toResult(job, queryHash, request.getMode(), startedAt);
            span.setAttribute("query.bytes_billed", result.getBytesBilled());
            span.setAttribute("query.cache_hit", result.isCacheHit());

            meterRegistry.timer("dashboards.query.duration",
                    "purpose", request.getPurpose().name(),
                    "cache_hit", String.valueOf(result.isCacheHit())
            ).record(result.getDurationMs(), TimeUnit.MILLISECONDS);
            meterRegistry.counter("dashboards.query.bytes.billed",
                    "purpose", request.getPurpose().name()
            ).increment(result.getBytesBilled());

            costLogger.record(logEntry(request, queryHash, startedAt)
                    .jobId(result.getJobId())
                    .bytesScanned(result.getBytesScanned())
                    .bytesBilled(result.getBytesBilled())
                    .durationMs(result.getDurationMs())
                    .rowCount(result.getTotalRows())
                    .cacheHit(result.isCacheHit())
                    .build());

            log.debug("Query {} finished: {} rows, {} bytes billed, {} (cache hit: {})",
                    queryHash, result.getTotalRows(), result.getBytesBilled(),
                    TimeUtils.formatDuration(result.getDurationMs()), result.isCacheHit());

            return GuardrailOutcome.success(result);

        } catch (EngineException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getReason().name());
            return reject(request, queryHash, startedAt, translate(e, byteCap, estimatedBytes));
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Unexpected engine failure");
            log.error("Unexpected failure executing query {}", queryHash, e);
            return reject(request, queryHash, startedAt,
                    GuardrailError.engineFailure("Unexpected engine failure: " + e.getMessage()));
        } finally {
            span.end();
        }
    }

    private long effectiveCap(Long override) {
        return override != null ? override : properties.getEngine().getMaxBytesBilled();
    }

    private QueryResult toResult(EngineJob job, String queryHash, ExecutionMode mode, Instant startedAt) {
        List<Map<String, Object>> rows = new ArrayList<>(job.getRows().size());
        for (Map<String, Object> row : job.getRows()) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            row.forEach((column, value) -> normalized.put(column, TimeUtils.toJsonFriendly(value)));
            rows.add(normalized);
        }

        long durationMs = job.getDurationMs() > 0
                ? job.getDurationMs()
                : Duration.between(startedAt, clock.instant()).toMillis();

        return QueryResult.builder()
                .jobId(job.getJobId())
                .queryHash(queryHash)
                .schema(job.getSchema())
                .rows(rows)
                .totalRows(job.getTotalRows())
                .bytesScanned(job.getBytesProcessed())
                .bytesBilled(job.getBytesBilled())
                .cacheHit(job.isCacheHit())
                .durationMs(durationMs)
                .sampled(mode == ExecutionMode.VERIFY && rows.size() < job.getTotalRows())
                .estimatedCostUsd(CostUtils.estimateCostUsd(job.getBytesBilled()))
                .executedAt(startedAt)
                .build();
    }

    private GuardrailError translate(EngineException e, long byteCap, Long estimatedBytes) {
        switch (e.getReason()) {
            case BYTES_LIMIT_EXCEEDED:
                long attempted = e.getBytesAttempted() != null
                        ? e.getBytesAttempted()
                        : estimatedBytes != null ? estimatedBytes : byteCap + 1;
                return GuardrailError.bytesLimitExceeded(attempted, byteCap);
            case INVALID_QUERY:
                return GuardrailError.validationFailed(e.getMessage());
            case TIMEOUT:
                return GuardrailError.engineFailure("Query timed out: " + e.getMessage());
            default:
                return GuardrailError.engineFailure(e.getMessage());
        }
    }

    private GuardrailOutcome reject(QueryExecutionRequest request, String queryHash,
                                    Instant startedAt, GuardrailError error) {
        meterRegistry.counter("dashboards.guardrail.rejections",
                "kind", error.getKind().name(),
                "purpose", request.getPurpose().name()
        ).increment();

        if (error.getKind() == GuardrailErrorKind.ENGINE_EXECUTION_ERROR) {
            log.warn("Query {} failed in the engine: {}", queryHash, error.getMessage());
        } else {
            log.info("Query {} rejected ({}): {}", queryHash, error.getKind(), error.getMessage());
        }

        costLogger.record(logEntry(request, queryHash, startedAt)
                .durationMs(Duration.between(startedAt, clock.instant()).toMillis())
                .errorCode(error.getKind().getErrorCode())
                .build());

        return GuardrailOutcome.rejected(error);
    }

    private QueryLogEntry.QueryLogEntryBuilder logEntry(QueryExecutionRequest request,
                                                        String queryHash, Instant startedAt) {
        return QueryLogEntry.builder()
                .queryHash(queryHash)
                .sqlPreview(SqlUtils.preview(request.getSql(), SqlUtils.LOG_PREVIEW_LENGTH))
                .purpose(request.getPurpose())
                .actor(request.getActor())
                .dashboardSlug(request.getDashboardSlug())
                .executedAt(startedAt);
    }
}

package com.company.dashboards.engine;

import com.company.dashboards.domain.SchemaField;
import com.company.dashboards.exception.EngineException;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobException;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobStatistics;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.TableResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RequiredArgsConstructor
public class BigQueryEngineClient implements QueryEngineClient {

    private final BigQuery bigQuery;
    private final String location;

    @Override
    public long dryRun(String sql) {
        QueryJobConfiguration config = QueryJobConfiguration.newBuilder(sql)
                .setDryRun(true)
                .setUseQueryCache(false)
                .build();
        try {
            Job job = bigQuery.create(JobInfo.of(config));
            JobStatistics.QueryStatistics stats = job.getStatistics();
            Long bytes = stats.getTotalBytesProcessed();
            return bytes != null ? bytes : 0L;
        } catch (BigQueryException e) {
            throw translate(e.getError(), e);
        }
    }

    @Override
    public EngineJob execute(String sql, JobConfig config) {
        QueryJobConfiguration.Builder queryConfig = QueryJobConfiguration.newBuilder(sql)
                .setUseQueryCache(config.isUseQueryCache())
                .setMaximumBytesBilled(config.getMaximumBytesBilled());
        if (config.getTimeout() != null) {
            queryConfig.setJobTimeoutMs(config.getTimeout().toMillis());
        }

        JobId jobId = JobId.newBuilder()
                .setJob("dash_" + UUID.randomUUID())
                .setLocation(location)
                .build();

        Job job;
        try {
            job = bigQuery.create(JobInfo.newBuilder(queryConfig.build()).setJobId(jobId).build());
            job = job.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelQuietly(jobId);
            throw new EngineException(EngineException.Reason.INTERRUPTED,
                    "Query " + jobId.getJob() + " cancelled", e);
        } catch (BigQueryException e) {
            throw translate(e.getError(), e);
        }

        if (job == null) {
            throw new EngineException(EngineException.Reason.BACKEND_ERROR,
                    "Job " + jobId.getJob() + " disappeared before completion");
        }
        if (job.getStatus().getError() != null) {
            throw translate(job.getStatus().getError(), null);
        }

        TableResult result;
        try {
            result = job.getQueryResults();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException(EngineException.Reason.INTERRUPTED,
                    "Interrupted while reading results of " + jobId.getJob(), e);
        } catch (JobException e) {
            throw new EngineException(EngineException.Reason.BACKEND_ERROR, e.getMessage(), e);
        } catch (BigQueryException e) {
            throw translate(e.getError(), e);
        }

        JobStatistics.QueryStatistics stats = job.getStatistics();
        FieldList fields = result.getSchema() != null ? result.getSchema().getFields() : FieldList.of();

        List<SchemaField> schema = new ArrayList<>();
        for (Field field : fields) {
            schema.add(new SchemaField(field.getName(), field.getType().getStandardType().name()));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (FieldValueList values : result.iterateAll()) {
            if (config.getMaxRows() > 0 && rows.size() >= config.getMaxRows()) {
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < fields.size(); i++) {
                row.put(fields.get(i).getName(), convert(fields.get(i), values.get(i)));
            }
            rows.add(row);
        }

        long duration = stats.getStartTime() != null && stats.getEndTime() != null
                ? stats.getEndTime() - stats.getStartTime()
                : 0L;

        return EngineJob.builder()
                .jobId(jobId.getJob())
                .schema(schema)
                .rows(rows)
                .totalRows(result.getTotalRows())
                .bytesProcessed(valueOrZero(stats.getTotalBytesProcessed()))
                .bytesBilled(valueOrZero(stats.getTotalBytesBilled()))
                .cacheHit(Boolean.TRUE.equals(stats.getCacheHit()))
                .durationMs(duration)
                .build();
    }

    @Override
    public String engineName() {
        return "bigquery";
    }

    // Floats become BigDecimal so cached rows read back with the same type and value
    private Object convert(Field field, FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.getAttribute() != FieldValue.Attribute.PRIMITIVE) {
            return value.getValue().toString();
        }
        StandardSQLTypeName type = field.getType().getStandardType();
        switch (type) {
            case INT64:
                return value.getLongValue();
            case FLOAT64:
                double number = value.getDoubleValue();
                return Double.isFinite(number) ? BigDecimal.valueOf(number) : value.getStringValue();
            case NUMERIC:
            case BIGNUMERIC:
                return value.getNumericValue();
            case BOOL:
                return value.getBooleanValue();
            case TIMESTAMP:
                return Instant.EPOCH.plus(value.getTimestampValue(), ChronoUnit.MICROS).toString();
            default:
                return value.getStringValue();
        }
    }

    private void cancelQuietly(JobId jobId) {
        try {
            bigQuery.cancel(jobId);
        } catch (BigQueryException e) {
            log.warn("Failed to cancel BigQuery job {}: {}", jobId.getJob(), e.getMessage());
        }
    }

    private static long valueOrZero(Long value) {
        return value != null ? value : 0L;
    }

    static EngineException translate(BigQueryError error, Throwable cause) {
        String reason = error != null && error.getReason() != null ? error.getReason() : "";
        String message = error != null && error.getMessage() != null
                ? error.getMessage()
                : cause != null ? cause.getMessage() : "BigQuery job failed";

        if ("bytesBilledLimitExceeded".equals(reason)) {
            return new EngineException(EngineException.Reason.BYTES_LIMIT_EXCEEDED, message, cause);
        }
        if ("invalidQuery".equals(reason) || "invalid".equals(reason) || "notFound".equals(reason)) {
            return new EngineException(EngineException.Reason.INVALID_QUERY, message, cause);
        }
        if (reason.toLowerCase(Locale.ROOT).contains("timeout")) {
            return new EngineException(EngineException.Reason.TIMEOUT, message, cause);
        }
        return new EngineException(EngineException.Reason.BACKEND_ERROR, message, cause);
    }
}

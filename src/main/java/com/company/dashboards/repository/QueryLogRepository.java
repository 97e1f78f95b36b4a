package com.company.dashboards.repository;

import com.company.dashboards.domain.QueryLogEntry;
import com.company.dashboards.domain.enums.QueryPurpose;
import com.company.dashboards.dto.response.QueryCostSummary;
import com.company.dashboards.util.CostUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
@RequiredArgsConstructor
@Slf4j
public class QueryLogRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT id, query_hash, sql_preview, bytes_scanned, bytes_billed, duration_ms,
               row_count, job_id, cache_hit, purpose, actor, dashboard_slug,
               error_code, executed_at
        FROM query_logs
        """;

    public void insert(QueryLogEntry entry) {
        String sql = """
            INSERT INTO query_logs (
                query_hash, sql_preview, bytes_scanned, bytes_billed, duration_ms,
                row_count, job_id, cache_hit, purpose, actor, dashboard_slug,
                error_code, executed_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                entry.getQueryHash(),
                entry.getSqlPreview(),
                entry.getBytesScanned(),
                entry.getBytesBilled(),
                entry.getDurationMs(),
                entry.getRowCount(),
                entry.getJobId(),
                entry.isCacheHit(),
                entry.getPurpose().name(),
                entry.getActor(),
                entry.getDashboardSlug(),
                entry.getErrorCode(),
                Timestamp.from(entry.getExecutedAt())
        );
    }

    public List<QueryLogEntry> findRecentByDashboard(String dashboardSlug, int limit) {
        String sql = SELECT_BASE + " WHERE dashboard_slug = ? ORDER BY executed_at DESC LIMIT ?";
        return jdbcTemplate.query(sql, new QueryLogRowMapper(), dashboardSlug, limit);
    }

    public QueryCostSummary summarizeSince(Instant since) {
        String sql = """
            SELECT COUNT(*) AS query_count,
                   COALESCE(SUM(CASE WHEN error_code IS NOT NULL THEN 1 ELSE 0 END), 0) AS failed_count,
                   COALESCE(SUM(CASE WHEN cache_hit THEN 1 ELSE 0 END), 0) AS cache_hit_count,
                   COALESCE(SUM(bytes_billed), 0) AS bytes_billed
            FROM query_logs
            WHERE executed_at >= ?
            """;

        return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> {
            long bytesBilled = rs.getLong("bytes_billed");
            return QueryCostSummary.builder()
                    .since(since)
                    .queryCount(rs.getLong("query_count"))
                    .failedCount(rs.getLong("failed_count"))
                    .cacheHitCount(rs.getLong("cache_hit_count"))
                    .bytesBilled(bytesBilled)
                    .estimatedCostUsd(CostUtils.estimateCostUsd(bytesBilled))
                    .build();
        }, Timestamp.from(since));
    }

    private static class QueryLogRowMapper implements RowMapper<QueryLogEntry> {
        @Override
        public QueryLogEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            return QueryLogEntry.builder()
                    .id(rs.getLong("id"))
                    .queryHash(rs.getString("query_hash"))
                    .sqlPreview(rs.getString("sql_preview"))
                    .bytesScanned(rs.getLong("bytes_scanned"))
                    .bytesBilled(rs.getLong("bytes_billed"))
                    .durationMs(rs.getLong("duration_ms"))
                    .rowCount(rs.getLong("row_count"))
                    .jobId(rs.getString("job_id"))
                    .cacheHit(rs.getBoolean("cache_hit"))
                    .purpose(QueryPurpose.fromString(rs.getString("purpose")))
                    .actor(rs.getString("actor"))
                    .dashboardSlug(rs.getString("dashboard_slug"))
                    .errorCode(rs.getString("error_code"))
                    .executedAt(rs.getTimestamp("executed_at").toInstant())
                    .build();
        }
    }
}

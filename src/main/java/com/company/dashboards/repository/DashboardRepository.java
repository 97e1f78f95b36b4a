package com.company.dashboards.repository;

import com.company.dashboards.domain.DashboardDefinition;
import com.company.dashboards.domain.DashboardMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Catalog of validated dashboard definitions. The definition body is stored as JSON; version,
 * freshness and access stats live in their own columns and win over the JSON copy.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class DashboardRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private static final String SELECT_BASE = """
        SELECT slug, version, definition, access_count, last_accessed_at,
               last_refreshed_at, created_at, updated_at
        FROM dashboards
        """;

    public Optional<DashboardDefinition> findBySlug(String slug) {
        String sql = SELECT_BASE + " WHERE slug = ?";

        List<DashboardDefinition> results = jdbcTemplate.query(sql, new DashboardRowMapper(objectMapper), slug);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<String> findAllSlugs() {
        return jdbcTemplate.queryForList("SELECT slug FROM dashboards ORDER BY slug", String.class);
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM dashboards", Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Stores a definition as the next version of its slug (1 for a new slug) and returns the
     * stored copy. The caller's instance is left untouched.
     */
    @Transactional
    public DashboardDefinition save(DashboardDefinition definition) {
        String slug = definition.getSlug();
        Instant now = clock.instant();

        // Lock the row so concurrent saves of one slug get distinct versions
        List<Integer> current = jdbcTemplate.queryForList(
                "SELECT version FROM dashboards WHERE slug = ? FOR UPDATE", Integer.class, slug);
        List<Timestamp> createdAt = jdbcTemplate.queryForList(
                "SELECT created_at FROM dashboards WHERE slug = ?", Timestamp.class, slug);

        int nextVersion = current.isEmpty() ? 1 : current.get(0) + 1;
        DashboardMetadata metadata = definition.getMetadata().toBuilder()
                .version(nextVersion)
                .createdAt(createdAt.isEmpty() ? now : createdAt.get(0).toInstant())
                .updatedAt(now)
                .build();
        DashboardDefinition saved = definition.withMetadata(metadata);
        String json = toJson(saved);

        if (current.isEmpty()) {
            jdbcTemplate.update("""
                INSERT INTO dashboards (
                    slug, name, owner, view_type, version, definition,
                    access_count, created_at, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, 0, ?, ?)
                """,
                    slug,
                    metadata.getName(),
                    metadata.getOwner(),
                    metadata.getViewType().getWireName(),
                    nextVersion,
                    json,
                    Timestamp.from(metadata.getCreatedAt()),
                    Timestamp.from(now));
        } else {
            jdbcTemplate.update("""
                UPDATE dashboards
                SET name = ?, owner = ?, view_type = ?, version = ?, definition = ?, updated_at = ?
                WHERE slug = ?
                """,
                    metadata.getName(),
                    metadata.getOwner(),
                    metadata.getViewType().getWireName(),
                    nextVersion,
                    json,
                    Timestamp.from(now),
                    slug);
        }

        log.info("Saved dashboard {} as version {}", slug, nextVersion);
        return findBySlug(slug).orElse(saved);
    }

    public void recordAccess(String slug, Instant accessedAt) {
        jdbcTemplate.update("""
            UPDATE dashboards
            SET access_count = access_count + 1, last_accessed_at = ?
            WHERE slug = ?
            """, Timestamp.from(accessedAt), slug);
    }

    public void markRefreshed(String slug, Instant refreshedAt) {
        jdbcTemplate.update(
                "UPDATE dashboards SET last_refreshed_at = ? WHERE slug = ?",
                Timestamp.from(refreshedAt), slug);
    }

    public boolean delete(String slug) {
        return jdbcTemplate.update("DELETE FROM dashboards WHERE slug = ?", slug) > 0;
    }

    private String toJson(DashboardDefinition definition) {
        try {
            return objectMapper.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Dashboard " + definition.getSlug() + " cannot be serialized", e);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static class DashboardRowMapper implements RowMapper<DashboardDefinition> {
        private final ObjectMapper objectMapper;

        DashboardRowMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
        }

        @Override
        public DashboardDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            DashboardDefinition definition;
            try {
                definition = objectMapper.readValue(rs.getString("definition"), DashboardDefinition.class);
            } catch (JsonProcessingException e) {
                throw new SQLException("Corrupt definition for dashboard " + rs.getString("slug"), e);
            }

            DashboardMetadata metadata = definition.getMetadata().toBuilder()
                    .version(rs.getInt("version"))
                    .accessCount(rs.getLong("access_count"))
                    .lastAccessedAt(toInstant(rs.getTimestamp("last_accessed_at")))
                    .lastRefreshedAt(toInstant(rs.getTimestamp("last_refreshed_at")))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
            return definition.withMetadata(metadata);
        }
    }
}

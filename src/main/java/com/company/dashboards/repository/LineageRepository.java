package com.company.dashboards.repository;

import com.company.dashboards.domain.LineageEdge;
import com.company.dashboards.domain.LineageGraph;
import com.company.dashboards.domain.LineageNode;
import com.company.dashboards.domain.enums.EdgeType;
import com.company.dashboards.domain.enums.NodeType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;

/**
 * Lineage nodes and edges. Dashboard, chart and query nodes and every edge are scoped to one
 * dashboard through {@code dashboard_slug}; table nodes are shared and carry no slug.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class LineageRepository {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String SELECT_EDGES = """
        SELECT source_type, source_id, target_type, target_id, edge_type
        FROM lineage_edges
        """;

    /**
     * Replaces everything scoped to {@code slug} in one transaction. Readers of that dashboard
     * see either the old or the new graph; other dashboards are untouched.
     */
    @Transactional
    public void replaceDashboardLineage(String slug, List<LineageNode> nodes, List<LineageEdge> edges) {
        int edgesDeleted = jdbcTemplate.update("DELETE FROM lineage_edges WHERE dashboard_slug = ?", slug);
        int nodesDeleted = jdbcTemplate.update("DELETE FROM lineage_nodes WHERE dashboard_slug = ?", slug);

        List<Object[]> scopedNodes = new ArrayList<>();
        List<Object[]> tableNodes = new ArrayList<>();
        int ordinal = 0;
        for (LineageNode node : nodes) {
            String metadata = toJson(node.getMetadata());
            if (node.getNodeType() == NodeType.TABLE) {
                tableNodes.add(new Object[]{node.getNodeType().getWireName(), node.getNodeId(), metadata});
            } else {
                scopedNodes.add(new Object[]{
                        node.getNodeType().getWireName(), node.getNodeId(), slug, metadata, ordinal++});
            }
        }

        jdbcTemplate.batchUpdate("""
            INSERT INTO lineage_nodes (node_type, node_id, dashboard_slug, metadata, ordinal)
            VALUES (?, ?, ?, ?, ?)
            """, scopedNodes);

        jdbcTemplate.batchUpdate("""
            INSERT INTO lineage_nodes (node_type, node_id, dashboard_slug, metadata, ordinal)
            VALUES (?, ?, NULL, ?, 0)
            ON CONFLICT DO NOTHING
            """, tableNodes);

        List<Object[]> edgeRows = new ArrayList<>();
        ordinal = 0;
        for (LineageEdge edge : edges) {
            edgeRows.add(new Object[]{
                    edge.getSourceType().getWireName(), edge.getSourceId(),
                    edge.getTargetType().getWireName(), edge.getTargetId(),
                    edge.getEdgeType().getWireName(), slug, ordinal++});
        }
        jdbcTemplate.batchUpdate("""
            INSERT INTO lineage_edges (
                source_type, source_id, target_type, target_id, edge_type, dashboard_slug, ordinal
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            """, edgeRows);

        int orphans = deleteOrphanTables();

        log.info("Rebuilt lineage for {}: {} nodes / {} edges replaced by {} / {} ({} orphan tables removed)",
                slug, nodesDeleted, edgesDeleted, nodes.size(), edges.size(), orphans);
    }

    @Transactional
    public void deleteDashboardLineage(String slug) {
        jdbcTemplate.update("DELETE FROM lineage_edges WHERE dashboard_slug = ?", slug);
        jdbcTemplate.update("DELETE FROM lineage_nodes WHERE dashboard_slug = ?", slug);
        deleteOrphanTables();
    }

    /**
     * Full graph for one dashboard, or empty when no lineage was ever built for it.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Optional<LineageGraph> findGraph(String slug) {
        List<LineageNode> nodes = new ArrayList<>(jdbcTemplate.query("""
            SELECT node_type, node_id, metadata
            FROM lineage_nodes
            WHERE dashboard_slug = ?
            ORDER BY ordinal
            """, new LineageNodeRowMapper(objectMapper), slug));

        if (nodes.stream().noneMatch(n -> n.getNodeType() == NodeType.DASHBOARD)) {
            return Optional.empty();
        }

        List<LineageEdge> edges = jdbcTemplate.query(
                SELECT_EDGES + " WHERE dashboard_slug = ? ORDER BY ordinal",
                new LineageEdgeRowMapper(), slug);

        Map<String, LineageNode> tables = new TreeMap<>();
        for (LineageNode table : jdbcTemplate.query("""
            SELECT n.node_type, n.node_id, n.metadata
            FROM lineage_nodes n
            WHERE n.node_type = 'table'
              AND n.node_id IN (
                  SELECT e.target_id FROM lineage_edges e
                  WHERE e.dashboard_slug = ? AND e.edge_type = 'reads_from'
              )
            """, new LineageNodeRowMapper(objectMapper), slug)) {
            tables.put(table.getNodeId(), table);
        }
        // A concurrent rebuild elsewhere may have pruned a shared table row; the edge is still authoritative
        for (LineageEdge edge : edges) {
            if (edge.getEdgeType() == EdgeType.READS_FROM && !tables.containsKey(edge.getTargetId())) {
                tables.put(edge.getTargetId(), LineageNode.of(NodeType.TABLE, edge.getTargetId(),
                        Map.of("table_name", edge.getTargetId())));
            }
        }
        nodes.addAll(tables.values());

        return Optional.of(LineageGraph.builder()
                .dashboardSlug(slug)
                .nodes(nodes)
                .edges(edges)
                .build());
    }

    public List<String> findUpstreamTables(String slug) {
        return jdbcTemplate.queryForList("""
            SELECT DISTINCT target_id
            FROM lineage_edges
            WHERE dashboard_slug = ? AND edge_type = 'reads_from'
            ORDER BY target_id
            """, String.class, slug);
    }

    /**
     * Dashboards reached from a table by walking reads_from, executes and contains edges backwards.
     */
    public List<String> findDownstreamDashboards(String tableId) {
        return jdbcTemplate.queryForList("""
            SELECT DISTINCT d.source_id
            FROM lineage_edges r
            JOIN lineage_edges x
              ON x.edge_type = 'executes' AND x.target_type = 'query' AND x.target_id = r.source_id
            JOIN lineage_edges d
              ON d.edge_type = 'contains' AND d.target_type = 'chart' AND d.target_id = x.source_id
            WHERE r.edge_type = 'reads_from' AND r.target_type = 'table' AND r.target_id = ?
            ORDER BY d.source_id
            """, String.class, tableId);
    }

    public boolean dashboardExists(String slug) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM lineage_nodes WHERE node_type = 'dashboard' AND node_id = ?",
                Integer.class, slug);
        return count != null && count > 0;
    }

    private int deleteOrphanTables() {
        return jdbcTemplate.update("""
            DELETE FROM lineage_nodes
            WHERE node_type = 'table'
              AND NOT EXISTS (
                  SELECT 1 FROM lineage_edges e
                  WHERE e.target_type = 'table' AND e.target_id = lineage_nodes.node_id
              )
            """);
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Lineage metadata is not serializable", e);
        }
    }

    private static class LineageNodeRowMapper implements RowMapper<LineageNode> {
        private final ObjectMapper objectMapper;

        LineageNodeRowMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
        }

        @Override
        public LineageNode mapRow(ResultSet rs, int rowNum) throws SQLException {
            String json = rs.getString("metadata");
            Map<String, Object> metadata;
            try {
                metadata = json != null ? objectMapper.readValue(json, METADATA_TYPE) : new LinkedHashMap<>();
            } catch (JsonProcessingException e) {
                throw new SQLException("Corrupt metadata on lineage node " + rs.getString("node_id"), e);
            }
            return LineageNode.of(NodeType.fromString(rs.getString("node_type")),
                    rs.getString("node_id"), metadata);
        }
    }

    private static class LineageEdgeRowMapper implements RowMapper<LineageEdge> {
        @Override
        public LineageEdge mapRow(ResultSet rs, int rowNum) throws SQLException {
            return LineageEdge.builder()
                    .sourceType(NodeType.fromString(rs.getString("source_type")))
                    .sourceId(rs.getString("source_id"))
                    .targetType(NodeType.fromString(rs.getString("target_type")))
                    .targetId(rs.getString("target_id"))
                    .edgeType(EdgeType.fromString(rs.getString("edge_type")))
                    .build();
        }
    }
}

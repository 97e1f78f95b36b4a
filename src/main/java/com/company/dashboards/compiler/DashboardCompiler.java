package com.company.dashboards.compiler;

import com.company.dashboards.domain.*;
import com.company.dashboards.domain.enums.EdgeType;
import com.company.dashboards.domain.enums.NodeType;
import com.company.dashboards.dto.response.ExecutionEstimate;
import com.company.dashboards.exception.CompilationException;
import com.company.dashboards.util.SqlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.Locale;

/**
 * Turns a validated {@link DashboardDefinition} into an {@link ExecutionPlan} and the lineage
 * seeds for the same version. No I/O: the same definition always yields equal output.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DashboardCompiler {

    static final long BASE_QUERY_MS = 500;
    static final long LONG_SQL_PENALTY_MS = 500;
    static final long JOIN_PENALTY_MS = 300;
    static final long AGGREGATE_PENALTY_MS = 200;
    static final int LONG_SQL_THRESHOLD = 1000;

    private static final List<String> AGGREGATE_MARKERS = List.of("sum(", "count(", "avg(", "group by");

    private final TableReferenceExtractor tableReferenceExtractor;

    public CompilationResult compile(DashboardDefinition definition) {
        String slug = definition.getSlug();
        try {
            CompilationResult result = doCompile(definition);
            log.debug("Compiled dashboard {} v{}: {} queries, {} charts, {} lineage nodes",
                    slug, definition.getVersion(), result.getPlan().getTotalQueries(),
                    result.getPlan().getTotalCharts(), result.getLineageNodes().size());
            return result;
        } catch (RuntimeException e) {
            log.error("Compilation failed for dashboard {}", slug, e);
            throw new CompilationException(slug, e);
        }
    }

    private CompilationResult doCompile(DashboardDefinition definition) {
        String slug = definition.getSlug();

        // Step 1: which charts depend on each query
        Map<String, List<String>> chartsByQuery = new LinkedHashMap<>();
        for (QueryDefinition query : definition.getQueries()) {
            chartsByQuery.put(query.getId(), new ArrayList<>());
        }
        for (LayoutItem item : definition.getLayout()) {
            List<String> dependents = chartsByQuery.get(item.getQueryRef());
            if (dependents != null) {
                dependents.add(item.getId());
            }
        }

        List<QueryDescriptor> queryDescriptors = new ArrayList<>();
        for (QueryDefinition query : definition.getQueries()) {
            queryDescriptors.add(QueryDescriptor.builder()
                    .queryId(query.getId())
                    .queryHash(query.getQueryHash())
                    .warehouse(query.getWarehouse())
                    .sql(query.getSql())
                    .maxBytesBilled(query.getMaxBytesBilled())
                    .dependentCharts(List.copyOf(chartsByQuery.get(query.getId())))
                    .executionOrder(0)
                    .build());
        }

        // Step 2: chart descriptors
        List<ChartDescriptor> chartDescriptors = new ArrayList<>();
        for (LayoutItem item : definition.getLayout()) {
            chartDescriptors.add(ChartDescriptor.builder()
                    .chartId(item.getId())
                    .chartType(item.getType())
                    .queryRef(item.getQueryRef())
                    .position(item.getPosition())
                    .config(item.getConfig())
                    .build());
        }

        ExecutionPlan plan = ExecutionPlan.builder()
                .dashboardSlug(slug)
                .version(definition.getVersion())
                .queries(queryDescriptors)
                .charts(chartDescriptors)
                .totalQueries(queryDescriptors.size())
                .totalCharts(chartDescriptors.size())
                .build();

        // Step 3: lineage seeds
        List<LineageNode> nodes = new ArrayList<>();
        List<LineageEdge> edges = new ArrayList<>();

        LineageNode dashboardNode = dashboardNode(definition.getMetadata());
        nodes.add(dashboardNode);

        Map<String, LineageNode> queryNodes = new LinkedHashMap<>();
        for (QueryDefinition query : definition.getQueries()) {
            queryNodes.put(query.getId(), queryNode(slug, query));
        }

        List<LineageEdge> executesEdges = new ArrayList<>();
        for (LayoutItem item : definition.getLayout()) {
            LineageNode chartNode = chartNode(slug, item);
            nodes.add(chartNode);
            edges.add(LineageEdge.of(dashboardNode, chartNode, EdgeType.CONTAINS));

            LineageNode queryNode = queryNodes.get(item.getQueryRef());
            if (queryNode != null) {
                executesEdges.add(LineageEdge.of(chartNode, queryNode, EdgeType.EXECUTES));
            }
        }
        nodes.addAll(queryNodes.values());
        edges.addAll(executesEdges);

        Map<String, LineageNode> tableNodes = new LinkedHashMap<>();
        for (QueryDefinition query : definition.getQueries()) {
            LineageNode queryNode = queryNodes.get(query.getId());
            for (String table : tableReferenceExtractor.extract(query.getSql())) {
                LineageNode tableNode = tableNodes.computeIfAbsent(table, DashboardCompiler::tableNode);
                edges.add(LineageEdge.of(queryNode, tableNode, EdgeType.READS_FROM));
            }
        }
        nodes.addAll(tableNodes.values());

        return CompilationResult.builder()
                .plan(plan)
                .lineageNodes(nodes)
                .lineageEdges(edges)
                .build();
    }

    /**
     * Rough cold-path latency. Queries run in parallel, so the dashboard estimate is the
     * slowest query rather than the sum.
     */
    public ExecutionEstimate estimateExecutionTime(DashboardDefinition definition) {
        Map<String, Long> perQuery = new LinkedHashMap<>();
        for (QueryDefinition query : definition.getQueries()) {
            perQuery.put(query.getId(), estimateQueryMs(query.getSql()));
        }
        long estimate = perQuery.values().stream().mapToLong(Long::longValue).max().orElse(0L);

        return ExecutionEstimate.builder()
                .dashboardSlug(definition.getSlug())
                .version(definition.getVersion())
                .perQueryMs(perQuery)
                .estimatedMs(estimate)
                .build();
    }

    static long estimateQueryMs(String sql) {
        String lower = sql == null ? "" : sql.toLowerCase(Locale.ROOT);
        long estimate = BASE_QUERY_MS;
        if (lower.length() > LONG_SQL_THRESHOLD) {
            estimate += LONG_SQL_PENALTY_MS;
        }
        if (lower.contains("join")) {
            estimate += JOIN_PENALTY_MS;
        }
        if (AGGREGATE_MARKERS.stream().anyMatch(lower::contains)) {
            estimate += AGGREGATE_PENALTY_MS;
        }
        return estimate;
    }

    public static String chartNodeId(String slug, String chartId) {
        return slug + ":chart:" + chartId;
    }

    public static String queryNodeId(String slug, String queryId) {
        return slug + ":query:" + queryId;
    }

    private static LineageNode dashboardNode(DashboardMetadata metadata) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", metadata.getName());
        attributes.put("owner", metadata.getOwner());
        attributes.put("view_type", metadata.getViewType().getWireName());
        return LineageNode.of(NodeType.DASHBOARD, metadata.getSlug(), attributes);
    }

    private static LineageNode chartNode(String slug, LayoutItem item) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("chart_type", item.getType().getWireName());
        attributes.put("title", item.getTitle());
        attributes.put("dashboard_slug", slug);
        return LineageNode.of(NodeType.CHART, chartNodeId(slug, item.getId()), attributes);
    }

    private static LineageNode queryNode(String slug, QueryDefinition query) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("warehouse", query.getWarehouse().getWireName());
        attributes.put("query_hash", query.getQueryHash());
        attributes.put("sql_preview", SqlUtils.preview(query.getSql(), SqlUtils.LINEAGE_PREVIEW_LENGTH));
        attributes.put("dashboard_slug", slug);
        return LineageNode.of(NodeType.QUERY, queryNodeId(slug, query.getId()), attributes);
    }

    private static LineageNode tableNode(String table) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("table_name", table);
        return LineageNode.of(NodeType.TABLE, table, attributes);
    }
}

package com.company.dashboards.compiler;

import com.company.dashboards.TestDashboards;
import com.company.dashboards.domain.*;
import com.company.dashboards.domain.enums.ChartType;
import com.company.dashboards.domain.enums.EdgeType;
import com.company.dashboards.domain.enums.NodeType;
import com.company.dashboards.dto.response.ExecutionEstimate;
import com.company.dashboards.exception.CompilationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DashboardCompilerTest {

    private final DashboardCompiler compiler = new DashboardCompiler(new RegexTableReferenceExtractor());
    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void buildsPlanWithQueryAndChartDescriptors() {
        ExecutionPlan plan = compiler.compile(TestDashboards.revenueDashboard()).getPlan();

        assertThat(plan.getDashboardSlug()).isEqualTo(TestDashboards.REVENUE);
        assertThat(plan.getVersion()).isEqualTo(1);
        assertThat(plan.getTotalQueries()).isEqualTo(2);
        assertThat(plan.getTotalCharts()).isEqualTo(3);
        assertThat(plan.getQueries()).extracting(QueryDescriptor::getQueryId)
                .containsExactly("monthly_revenue", "top_products");
        assertThat(plan.findQuery("monthly_revenue").orElseThrow().getDependentCharts())
                .containsExactly("revenue_trend", "revenue_total");
        assertThat(plan.findQuery("top_products").orElseThrow().getDependentCharts())
                .containsExactly("top_products_bar");
        assertThat(plan.findQuery("top_products").orElseThrow().getMaxBytesBilled()).isEqualTo(50_000_000L);
        assertThat(plan.findChart("revenue_total").orElseThrow().getChartType()).isEqualTo(ChartType.KPI);
        assertThat(plan.findChart("top_products_bar").orElseThrow().getPosition())
                .isEqualTo(GridPosition.of(0, 4, 12, 6));
    }

    @Test
    void emitsOneNodePerDashboardChartAndQueryPlusTables() {
        CompilationResult result = compiler.compile(TestDashboards.revenueDashboard());

        assertThat(result.getLineageNodes()).filteredOn(n -> n.getNodeType() == NodeType.DASHBOARD).hasSize(1);
        assertThat(result.getLineageNodes()).filteredOn(n -> n.getNodeType() == NodeType.CHART).hasSize(3);
        assertThat(result.getLineageNodes()).filteredOn(n -> n.getNodeType() == NodeType.QUERY).hasSize(2);
        assertThat(result.getLineageNodes()).filteredOn(n -> n.getNodeType() == NodeType.TABLE)
                .extracting(LineageNode::getNodeId)
                .containsExactly("acme-prod.sales.orders", "acme-prod.catalog.products");

        List<LineageEdge> edges = result.getLineageEdges();
        assertThat(edges).filteredOn(e -> e.getEdgeType() == EdgeType.CONTAINS).hasSize(3);
        assertThat(edges).filteredOn(e -> e.getEdgeType() == EdgeType.EXECUTES)
                .extracting(LineageEdge::getSourceId, LineageEdge::getTargetId)
                .containsExactly(
                        tuple("revenue-dashboard:chart:revenue_trend",
                                "revenue-dashboard:query:monthly_revenue"),
                        tuple("revenue-dashboard:chart:revenue_total",
                                "revenue-dashboard:query:monthly_revenue"),
                        tuple("revenue-dashboard:chart:top_products_bar",
                                "revenue-dashboard:query:top_products"));
        assertThat(edges).filteredOn(e -> e.getEdgeType() == EdgeType.READS_FROM).hasSize(3);
    }

    @Test
    void nodeMetadataDescribesEachNode() {
        CompilationResult result = compiler.compile(TestDashboards.revenueDashboard());

        LineageNode dashboard = result.getLineageNodes().get(0);
        assertThat(dashboard.getNodeId()).isEqualTo(TestDashboards.REVENUE);
        assertThat(dashboard.getMetadata())
                .containsEntry("name", "Revenue")
                .containsEntry("owner", "finance-analytics")
                .containsEntry("view_type", "strategic");

        LineageNode trend = result.getLineageNodes().stream()
                .filter(n -> n.getNodeId().equals("revenue-dashboard:chart:revenue_trend"))
                .findFirst().orElseThrow();
        assertThat(trend.getMetadata())
                .containsEntry("chart_type", "line_chart")
                .containsEntry("title", "Revenue by month");

        LineageNode query = result.getLineageNodes().stream()
                .filter(n -> n.getNodeType() == NodeType.QUERY)
                .findFirst().orElseThrow();
        assertThat(query.getMetadata()).containsKeys("query_hash", "sql_preview", "warehouse");
        assertThat(query.getMetadata().get("query_hash")).asString().hasSize(16);
    }

    @Test
    void compilingTwiceGivesIdenticalOutput() throws Exception {
        DashboardDefinition definition = TestDashboards.revenueDashboard();

        CompilationResult first = compiler.compile(definition);
        CompilationResult second = compiler.compile(definition);

        assertThat(objectMapper.writeValueAsString(first.getPlan()))
                .isEqualTo(objectMapper.writeValueAsString(second.getPlan()));
        assertThat(objectMapper.writeValueAsString(first.getLineageNodes()))
                .isEqualTo(objectMapper.writeValueAsString(second.getLineageNodes()));
        assertThat(objectMapper.writeValueAsString(first.getLineageEdges()))
                .isEqualTo(objectMapper.writeValueAsString(second.getLineageEdges()));
    }

    @Test
    void wrapsExtractorFailureAsCompilationException() {
        TableReferenceExtractor broken = mock(TableReferenceExtractor.class);
        when(broken.extract(anyString())).thenThrow(new IllegalStateException("boom"));

        DashboardCompiler failing = new DashboardCompiler(broken);

        assertThatThrownBy(() -> failing.compile(TestDashboards.revenueDashboard()))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void estimatesSlowestQuery() {
        ExecutionEstimate estimate = compiler.estimateExecutionTime(TestDashboards.revenueDashboard());

        // aggregate only
        assertThat(estimate.getPerQueryMs()).containsEntry("monthly_revenue", 700L);
        // join and aggregate
        assertThat(estimate.getPerQueryMs()).containsEntry("top_products", 1000L);
        assertThat(estimate.getEstimatedMs()).isEqualTo(1000L);
    }

    @Test
    void plainSelectGetsBaseEstimate() {
        assertThat(DashboardCompiler.estimateQueryMs("SELECT 1")).isEqualTo(DashboardCompiler.BASE_QUERY_MS);
    }
}

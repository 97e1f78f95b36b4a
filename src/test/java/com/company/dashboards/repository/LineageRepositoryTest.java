package com.company.dashboards.repository;

import com.company.dashboards.TestDashboards;
import com.company.dashboards.compiler.DashboardCompiler;
import com.company.dashboards.compiler.RegexTableReferenceExtractor;
import com.company.dashboards.domain.CompilationResult;
import com.company.dashboards.domain.DashboardDefinition;
import com.company.dashboards.domain.DashboardMetadata;
import com.company.dashboards.domain.GridPosition;
import com.company.dashboards.domain.LayoutItem;
import com.company.dashboards.domain.LineageGraph;
import com.company.dashboards.domain.LineageNode;
import com.company.dashboards.domain.QueryDefinition;
import com.company.dashboards.domain.enums.ChartType;
import com.company.dashboards.domain.enums.NodeType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Import({LineageRepository.class, RepositoryTestConfig.class})
class LineageRepositoryTest {

    private static final String OPS = "ops-orders";

    @Autowired
    private LineageRepository repository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final DashboardCompiler compiler = new DashboardCompiler(new RegexTableReferenceExtractor());

    @Test
    void storesAndReadsBackFullGraph() {
        store(TestDashboards.revenueDashboard());

        LineageGraph graph = repository.findGraph(TestDashboards.REVENUE).orElseThrow();

        assertThat(graph.getDashboardSlug()).isEqualTo(TestDashboards.REVENUE);
        assertThat(graph.getNodes()).filteredOn(n -> n.getNodeType() == NodeType.DASHBOARD)
                .extracting(LineageNode::getNodeId)
                .containsExactly(TestDashboards.REVENUE);
        assertThat(graph.getNodes()).filteredOn(n -> n.getNodeType() == NodeType.CHART).hasSize(3);
        assertThat(graph.getNodes()).filteredOn(n -> n.getNodeType() == NodeType.QUERY).hasSize(2);
        assertThat(graph.getNodes()).filteredOn(n -> n.getNodeType() == NodeType.TABLE)
                .extracting(LineageNode::getNodeId)
                .containsExactlyInAnyOrder("acme-prod.sales.orders", "acme-prod.catalog.products");
        assertThat(graph.getEdges()).hasSize(9);

        LineageNode dashboard = graph.getNodes().get(0);
        assertThat(dashboard.getMetadata()).containsEntry("owner", "finance-analytics");
    }

    @Test
    void graphOfUnknownDashboardIsEmpty() {
        assertThat(repository.findGraph("missing")).isEmpty();
        assertThat(repository.dashboardExists("missing")).isFalse();
    }

    @Test
    void upstreamTablesAreDistinctAndSorted() {
        store(TestDashboards.revenueDashboard());

        assertThat(repository.findUpstreamTables(TestDashboards.REVENUE))
                .containsExactly("acme-prod.catalog.products", "acme-prod.sales.orders");
        assertThat(repository.dashboardExists(TestDashboards.REVENUE)).isTrue();
    }

    @Test
    void downstreamWalksBackToEveryReadingDashboard() {
        store(TestDashboards.revenueDashboard());
        store(opsDashboard());

        assertThat(repository.findDownstreamDashboards("acme-prod.sales.orders"))
                .containsExactly(OPS, TestDashboards.REVENUE);
        assertThat(repository.findDownstreamDashboards("acme-prod.catalog.products"))
                .containsExactly(TestDashboards.REVENUE);
        assertThat(repository.findDownstreamDashboards("acme-prod.unknown.table")).isEmpty();
    }

    @Test
    void rebuildReplacesOnlyThatDashboard() {
        store(TestDashboards.revenueDashboard());
        store(opsDashboard());

        store(TestDashboards.revenueDashboard());

        assertThat(repository.findGraph(TestDashboards.REVENUE).orElseThrow().getEdges()).hasSize(9);
        assertThat(repository.findGraph(OPS).orElseThrow().getEdges()).hasSize(3);
        assertThat(countTables("acme-prod.sales.orders")).isEqualTo(1);
    }

    @Test
    void sharedTableSurvivesUntilLastReaderIsGone() {
        store(TestDashboards.revenueDashboard());
        store(opsDashboard());

        repository.deleteDashboardLineage(TestDashboards.REVENUE);

        assertThat(repository.findGraph(TestDashboards.REVENUE)).isEmpty();
        assertThat(countTables("acme-prod.catalog.products")).isZero();
        assertThat(countTables("acme-prod.sales.orders")).isEqualTo(1);
        assertThat(repository.findDownstreamDashboards("acme-prod.sales.orders")).containsExactly(OPS);

        repository.deleteDashboardLineage(OPS);

        assertThat(countTables("acme-prod.sales.orders")).isZero();
    }

    private void store(DashboardDefinition definition) {
        CompilationResult result = compiler.compile(definition);
        repository.replaceDashboardLineage(definition.getSlug(), result.getLineageNodes(), result.getLineageEdges());
    }

    private int countTables(String tableId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM lineage_nodes WHERE node_type = 'table' AND node_id = ?",
                Integer.class, tableId);
        return count != null ? count : 0;
    }

    private static DashboardDefinition opsDashboard() {
        return DashboardDefinition.builder()
                .metadata(DashboardMetadata.builder()
                        .slug(OPS)
                        .name("Order operations")
                        .owner("ops")
                        .build())
                .queries(List.of(QueryDefinition.builder()
                        .id("daily_orders")
                        .sql("SELECT day, COUNT(*) AS orders FROM acme-prod.sales.orders GROUP BY day")
                        .build()))
                .layout(List.of(LayoutItem.builder()
                        .id("orders_table")
                        .type(ChartType.TABLE)
                        .queryRef("daily_orders")
                        .position(GridPosition.of(0, 0, 12, 6))
                        .build()))
                .build();
    }
}

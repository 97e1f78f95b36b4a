package com.company.dashboards;

import com.company.dashboards.domain.DashboardDefinition;
import com.company.dashboards.domain.DashboardMetadata;
import com.company.dashboards.domain.GridPosition;
import com.company.dashboards.domain.LayoutItem;
import com.company.dashboards.domain.QueryDefinition;
import com.company.dashboards.domain.enums.ChartType;
import com.company.dashboards.domain.enums.ViewType;

/**
 * Definitions shared by the tests.
 */
public final class TestDashboards {

    public static final String REVENUE = "revenue-dashboard";

    public static final String MONTHLY_REVENUE_SQL = """
        SELECT month, SUM(amount) AS revenue
        FROM `acme-prod.sales.orders`
        GROUP BY month
        ORDER BY month
        """;

    public static final String TOP_PRODUCTS_SQL = """
        SELECT p.name, SUM(o.amount) AS revenue
        FROM acme-prod.sales.orders o
        JOIN acme-prod.catalog.products p ON p.id = o.product_id
        GROUP BY p.name
        """;

    private TestDashboards() {
    }

    /**
     * Two queries and three charts: a trend and a KPI on monthly_revenue, a bar chart on
     * top_products.
     */
    public static DashboardDefinition revenueDashboard() {
        return DashboardDefinition.builder()
                .metadata(DashboardMetadata.builder()
                        .slug(REVENUE)
                        .name("Revenue")
                        .owner("finance-analytics")
                        .viewType(ViewType.STRATEGIC)
                        .tag("finance")
                        .build())
                .query(QueryDefinition.builder().id("monthly_revenue").sql(MONTHLY_REVENUE_SQL).build())
                .query(QueryDefinition.builder().id("top_products").sql(TOP_PRODUCTS_SQL)
                        .maxBytesBilled(50_000_000L).build())
                .layoutItem(LayoutItem.builder()
                        .id("revenue_trend")
                        .type(ChartType.LINE_CHART)
                        .queryRef("monthly_revenue")
                        .position(GridPosition.of(0, 0, 8, 4))
                        .configEntry("title", "Revenue by month")
                        .configEntry("x_axis", "month")
                        .configEntry("y_axis", "revenue")
                        .build())
                .layoutItem(LayoutItem.builder()
                        .id("revenue_total")
                        .type(ChartType.KPI)
                        .queryRef("monthly_revenue")
                        .position(GridPosition.of(8, 0, 4, 4))
                        .configEntry("value_field", "revenue")
                        .build())
                .layoutItem(LayoutItem.builder()
                        .id("top_products_bar")
                        .type(ChartType.BAR_CHART)
                        .queryRef("top_products")
                        .position(GridPosition.of(0, 4, 12, 6))
                        .build())
                .build();
    }
}

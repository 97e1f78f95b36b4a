package com.company.dashboards.config;

import com.company.dashboards.engine.BigQueryEngineClient;
import com.company.dashboards.engine.QueryEngineClient;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * One engine client per process, built from application-default credentials.
 */
@Configuration
@Slf4j
public class QueryEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public BigQuery bigQuery(DashboardProperties properties) {
        DashboardProperties.Engine engine = properties.getEngine();
        BigQueryOptions.Builder options = BigQueryOptions.newBuilder()
                .setLocation(engine.getLocation());
        if (StringUtils.hasText(engine.getProjectId())) {
            options.setProjectId(engine.getProjectId());
        }
        BigQuery bigQuery = options.build().getService();
        log.info("BigQuery client ready for project {} ({})",
                bigQuery.getOptions().getProjectId(), engine.getLocation());
        return bigQuery;
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryEngineClient queryEngineClient(BigQuery bigQuery, DashboardProperties properties) {
        return new BigQueryEngineClient(bigQuery, properties.getEngine().getLocation());
    }
}

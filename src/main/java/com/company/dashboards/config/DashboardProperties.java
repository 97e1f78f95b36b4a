package com.company.dashboards.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under {@code dashboards.*}. Every value has a working default so the service
 * starts with an empty {@code application.yml}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "dashboards")
public class DashboardProperties {

    @Valid
    private Cache cache = new Cache();
    @Valid
    private Engine engine = new Engine();
    @Valid
    private Serving serving = new Serving();
    private Precompute precompute = new Precompute();
    private QueryLog queryLog = new QueryLog();
    private Lineage lineage = new Lineage();

    @Data
    public static class Cache {
        /** {@code local} for the in-process LRU, {@code redis} for the shared store. */
        @Pattern(regexp = "local|redis")
        private String type = "local";
        @NotNull
        private Duration dataTtl = Duration.ofHours(24);
        @NotNull
        private Duration lineageTtl = Duration.ofHours(1);
        @Min(1)
        private int maxEntries = 1000;
    }

    @Data
    public static class Engine {
        private String projectId;
        private String location = "US";
        /** Global byte-billing cap, overridable per query. */
        @Min(1)
        private long maxBytesBilled = 100_000_000L;
        private boolean useQueryCache = true;
        private Duration queryTimeout = Duration.ofSeconds(60);
        /** When non-empty, SQL must reference at least one of these datasets. */
        private List<String> allowedDatasets = new ArrayList<>();
    }

    @Data
    public static class Serving {
        @Min(1)
        private int maxConcurrentQueries = 10;
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Precompute {
        private boolean scheduled = false;
        private String cron = "0 0 * * * *";
        private List<String> slugs = new ArrayList<>();
        /** Warm the cache for a dashboard right after a save bumps its version. */
        private boolean warmOnSave = false;
    }

    @Data
    public static class Lineage {
        private boolean rebuildOnSave = true;
    }

    @Data
    public static class QueryLog {
        private boolean enabled = true;
    }
}

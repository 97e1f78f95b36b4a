package com.company.dashboards.engine;

/**
 * Minimal surface of a metered query engine. Failures are reported as
 * {@link com.company.dashboards.exception.EngineException} with a classified reason.
 */
public interface QueryEngineClient {

    /**
     * Bytes the statement would process, without running it or billing anything.
     */
    long dryRun(String sql);

    /**
     * Runs the statement and blocks until it finishes. An interrupted caller cancels the job.
     * Row values are limited to {@code Long}, {@code BigDecimal}, {@code Boolean} and
     * {@code String} (temporals as ISO-8601) so they survive a JSON cache unchanged.
     */
    EngineJob execute(String sql, JobConfig config);

    String engineName();
}

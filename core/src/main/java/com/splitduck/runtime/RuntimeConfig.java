package com.splitduck.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Configuration for the embedded DuckDB runtime of a single command.
 *
 * <p>The {@code jobs} value only controls DuckDB's internal scan/aggregate
 * parallelism. Sampling and shuffling decisions are computed before any
 * statement reaches the engine, so changing it never changes the output.
 *
 * <p>The memory limit defaults to the hardware recommendation and can be
 * overridden with the {@value #PROP_MEMORY_LIMIT} system property.
 */
public final class RuntimeConfig {

    private static final Logger logger = LoggerFactory.getLogger(RuntimeConfig.class);

    /** System property overriding the DuckDB memory limit (e.g. "2GB"). */
    public static final String PROP_MEMORY_LIMIT = "splitduck.memoryLimit";

    /** Default JDBC URL: a private in-memory database per runtime. */
    public static final String IN_MEMORY_URL = "jdbc:duckdb:";

    private final String jdbcUrl;
    private final OptionalInt jobs;
    private final String memoryLimit;

    private RuntimeConfig(String jdbcUrl, OptionalInt jobs, String memoryLimit) {
        this.jdbcUrl = jdbcUrl;
        this.jobs = jobs;
        this.memoryLimit = memoryLimit;
    }

    /**
     * Creates the default configuration: in-memory database, one thread per
     * core, memory limit from the system property or the hardware profile.
     *
     * @return the configuration
     */
    public static RuntimeConfig defaults() {
        return new RuntimeConfig(IN_MEMORY_URL, OptionalInt.empty(), getConfiguredMemoryLimit());
    }

    /**
     * Returns a copy with an explicit engine thread count.
     *
     * @param jobs number of engine threads, must be positive
     * @return the new configuration
     * @throws IllegalArgumentException if jobs is not positive
     */
    public RuntimeConfig withJobs(int jobs) {
        if (jobs <= 0) {
            throw new IllegalArgumentException("jobs must be positive, got: " + jobs);
        }
        return new RuntimeConfig(jdbcUrl, OptionalInt.of(jobs), memoryLimit);
    }

    /**
     * Returns a copy using a different JDBC URL (e.g. a persistent database file).
     *
     * @param url the DuckDB JDBC URL
     * @return the new configuration
     */
    public RuntimeConfig withJdbcUrl(String url) {
        return new RuntimeConfig(Objects.requireNonNull(url, "url must not be null"), jobs, memoryLimit);
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    public OptionalInt jobs() {
        return jobs;
    }

    /**
     * Returns the configured memory limit, or null to use the hardware recommendation.
     *
     * @return the memory limit string or null
     */
    public String memoryLimit() {
        return memoryLimit;
    }

    private static String getConfiguredMemoryLimit() {
        String value = System.getProperty(PROP_MEMORY_LIMIT);
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (!trimmed.matches("\\d+(\\.\\d+)?\\s*[KMGT]?i?B")) {
            logger.warn("Ignoring invalid {} value '{}', using hardware default", PROP_MEMORY_LIMIT, value);
            return null;
        }
        return trimmed;
    }

    @Override
    public String toString() {
        return String.format("RuntimeConfig(url=%s, jobs=%s, memoryLimit=%s)",
            jdbcUrl,
            jobs.isPresent() ? String.valueOf(jobs.getAsInt()) : "auto",
            memoryLimit != null ? memoryLimit : "auto");
    }
}

package com.splitduck.runtime;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * DuckDB runtime - owns the single DuckDB connection used by one command.
 *
 * <p>The runtime is responsible for creating, configuring, and closing the
 * connection. A command opens exactly one runtime, runs every row store
 * operation on it sequentially, and closes it before returning.
 *
 * <p>Typical usage:
 * <pre>{@code
 * try (DuckDBRuntime runtime = DuckDBRuntime.create(RuntimeConfig.defaults().withJobs(4))) {
 *     QueryExecutor executor = new QueryExecutor(runtime);
 *     // ... execute queries ...
 * }
 * }</pre>
 *
 * <p>Test usage:
 * <pre>{@code
 * @BeforeEach
 * void setup() {
 *     runtime = DuckDBRuntime.create();
 * }
 *
 * @AfterEach
 * void teardown() {
 *     runtime.close();
 * }
 * }</pre>
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    private final RuntimeConfig config;
    private final DuckDBConnection connection;
    private final HardwareProfile hardware;
    private volatile boolean closed = false;

    /**
     * Private constructor - use create() factory method.
     *
     * @param config runtime configuration
     * @throws SQLException if connection fails
     */
    private DuckDBRuntime(RuntimeConfig config) throws SQLException {
        this.config = config;
        this.hardware = HardwareProfile.detect();

        logger.info("Creating DuckDB runtime: {}", config);

        Connection rawConn = DriverManager.getConnection(config.jdbcUrl());
        this.connection = rawConn.unwrap(DuckDBConnection.class);
        try {
            configureConnection();
        } catch (SQLException e) {
            connection.close();
            throw e;
        }

        logger.debug("DuckDB runtime initialized on {}", hardware);
    }

    /**
     * Configure the connection.
     *
     * <p>Configuration includes:
     * <ul>
     *   <li>Memory limit from config or hardware profile</li>
     *   <li>Thread count from {@code jobs} or available cores</li>
     *   <li>Insertion order preservation, so scans and COPY keep row order</li>
     * </ul>
     */
    private void configureConnection() throws SQLException {
        String memoryLimit = config.memoryLimit() != null
            ? config.memoryLimit()
            : hardware.recommendedMemoryLimit();
        int threads = config.jobs().orElse(hardware.recommendedThreadCount());

        try (Statement stmt = connection.createStatement()) {
            stmt.execute(String.format("SET memory_limit='%s'", memoryLimit));
            stmt.execute(String.format("SET threads=%d", threads));
            stmt.execute("SET enable_progress_bar=false");
            stmt.execute("SET preserve_insertion_order=true");

            logger.debug("DuckDB configured: memory={}, threads={}", memoryLimit, threads);
        }
    }

    /**
     * Create a new DuckDBRuntime with the default configuration.
     *
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if connection fails
     */
    public static DuckDBRuntime create() {
        return create(RuntimeConfig.defaults());
    }

    /**
     * Create a new DuckDBRuntime with a custom configuration.
     *
     * @param config the runtime configuration
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if connection fails
     */
    public static DuckDBRuntime create(RuntimeConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        try {
            return new DuckDBRuntime(config);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create DuckDB runtime: " + config.jdbcUrl(), e);
        }
    }

    /**
     * Get the underlying DuckDB connection.
     *
     * <p>The connection is managed by the runtime - callers should NOT close it.
     *
     * @return the DuckDB connection
     * @throws IllegalStateException if runtime is closed
     */
    public DuckDBConnection getConnection() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime is closed");
        }
        return connection;
    }

    public RuntimeConfig getConfig() {
        return config;
    }

    public HardwareProfile getHardwareProfile() {
        return hardware;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Close the runtime and release the connection.
     *
     * <p>After closing, the runtime cannot be used.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        try {
            connection.close();
            logger.debug("DuckDB connection closed");
        } catch (SQLException e) {
            logger.error("Error closing DuckDB connection", e);
        }
    }
}

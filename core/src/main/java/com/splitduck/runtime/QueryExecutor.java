package com.splitduck.runtime;

import com.splitduck.exception.QueryExecutionException;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes SQL against the command's DuckDB runtime.
 *
 * <p>All calls are synchronous request/response on the runtime's single
 * connection. Every SQLException is wrapped in a
 * {@link QueryExecutionException} carrying the failed SQL.
 *
 * <p>Example usage:
 * <pre>
 *   QueryExecutor executor = new QueryExecutor(runtime);
 *
 *   long rows = executor.queryForLong("SELECT COUNT(*) FROM source");
 *
 *   executor.executeUpdate("CREATE TEMP TABLE t (id BIGINT)");
 * </pre>
 *
 * @see DuckDBRuntime
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private static final int MAX_LOGGED_SQL = 400;

    private final DuckDBRuntime runtime;

    /**
     * Creates a query executor bound to a runtime.
     *
     * @param runtime the DuckDB runtime
     */
    public QueryExecutor(DuckDBRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
    }

    /**
     * Executes a query and materializes all rows.
     *
     * @param sql the SQL query to execute
     * @return the query results
     * @throws QueryExecutionException if query execution fails
     */
    public QueryResult executeQuery(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");
        logSQL(sql);

        long start = System.nanoTime();
        DuckDBConnection conn = runtime.getConnection();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {

            ResultSetMetaData meta = rs.getMetaData();
            int columnCount = meta.getColumnCount();
            List<String> columns = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                columns.add(meta.getColumnLabel(i));
            }

            List<List<Object>> rows = new ArrayList<>();
            while (rs.next()) {
                List<Object> row = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    row.add(rs.getObject(i));
                }
                rows.add(row);
            }

            if (logger.isDebugEnabled()) {
                logger.debug("Query returned {} rows in {} ms",
                    rows.size(), (System.nanoTime() - start) / 1_000_000);
            }
            return new QueryResult(columns, rows);

        } catch (SQLException e) {
            throw new QueryExecutionException(
                "Failed to execute query: " + e.getMessage(), e, sql);
        }
    }

    /**
     * Executes a query returning a single numeric value.
     *
     * @param sql the SQL query, producing one row with one numeric column
     * @return the value as a long
     * @throws QueryExecutionException if execution fails or no row is returned
     */
    public long queryForLong(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");
        logSQL(sql);

        DuckDBConnection conn = runtime.getConnection();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            if (!rs.next()) {
                throw new QueryExecutionException("Query returned no rows", sql);
            }
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new QueryExecutionException(
                "Failed to execute query: " + e.getMessage(), e, sql);
        }
    }

    /**
     * Returns the output column names of a query without executing it over data.
     *
     * @param sql the SQL query
     * @return the column names, in order
     * @throws QueryExecutionException if the query cannot be bound
     */
    public List<String> columnNames(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");
        return executeQuery("SELECT * FROM (" + sql + ") AS schema_probe LIMIT 0").columnNames();
    }

    /**
     * Executes an update/DDL statement.
     *
     * <p>Used for CREATE, DROP, INSERT and COPY statements.
     *
     * @param sql the SQL statement to execute
     * @return the number of rows affected (for DML), or 0 (for DDL)
     * @throws QueryExecutionException if statement execution fails
     */
    public int executeUpdate(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");
        logSQL(sql);

        DuckDBConnection conn = runtime.getConnection();
        try (Statement stmt = conn.createStatement()) {
            return stmt.executeUpdate(sql);
        } catch (SQLException e) {
            throw new QueryExecutionException(
                "Failed to execute update: " + e.getMessage(), e, sql);
        }
    }

    /**
     * Executes any statement (query or update), discarding the result.
     *
     * @param sql the SQL statement to execute
     * @return true if the result is a ResultSet, false if it's an update count
     * @throws QueryExecutionException if statement execution fails
     */
    public boolean execute(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");
        logSQL(sql);

        DuckDBConnection conn = runtime.getConnection();
        try (Statement stmt = conn.createStatement()) {
            return stmt.execute(sql);
        } catch (SQLException e) {
            throw new QueryExecutionException(
                "Failed to execute statement: " + e.getMessage(), e, sql);
        }
    }

    public DuckDBRuntime getRuntime() {
        return runtime;
    }

    private void logSQL(String sql) {
        if (logger.isDebugEnabled()) {
            String truncated = sql.length() > MAX_LOGGED_SQL ? sql.substring(0, MAX_LOGGED_SQL) + "..." : sql;
            logger.debug("Executing: {}", truncated);
        }
    }
}

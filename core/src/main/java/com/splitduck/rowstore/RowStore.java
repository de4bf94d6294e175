package com.splitduck.rowstore;

import com.splitduck.exception.ColumnNotFoundException;
import com.splitduck.exception.InvalidArgumentException;
import com.splitduck.exception.QueryExecutionException;
import com.splitduck.exception.StatisticsException;
import com.splitduck.generator.SQLGenerator;
import com.splitduck.io.DatasetReader;
import com.splitduck.io.DatasetWriter;
import com.splitduck.io.FileFormat;
import com.splitduck.logical.Limit;
import com.splitduck.logical.LogicalPlan;
import com.splitduck.logical.MaterializedView;
import com.splitduck.logical.SourceTable;
import com.splitduck.runtime.DuckDBRuntime;
import com.splitduck.runtime.QueryExecutor;
import com.splitduck.runtime.QueryResult;
import com.splitduck.sampling.Permutation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.splitduck.generator.SQLQuoting.quoteIdentifier;

/**
 * Command-scoped row store backed by the embedded DuckDB engine.
 *
 * <p>Datasets are loaded once into temporary tables; every other view is a
 * {@link LogicalPlan} over those tables, executed on demand. Temporary
 * tables created through this store (registered sources, mapping tables,
 * materialized views) are dropped when the store is closed, so a command
 * should always use it in a try-with-resources block:
 *
 * <pre>
 *   try (DuckDBRuntime runtime = DuckDBRuntime.create(config);
 *        RowStore store = new RowStore(runtime)) {
 *       LogicalPlan source = store.register(Path.of("data.parquet"));
 *       long rows = store.count(source);
 *       store.write(new Limit(source, 0, 10), Path.of("head.csv"), FileFormat.CSV);
 *   }
 * </pre>
 *
 * <p>The store does not own the runtime; closing the store leaves the
 * connection open.
 */
public class RowStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RowStore.class);

    private static final String SOURCE_PREFIX = "sd_source_";
    private static final String MAPPING_PREFIX = "sd_mapping_";
    private static final String MATERIALIZED_PREFIX = "sd_materialized_";

    private final QueryExecutor executor;
    private final DatasetReader reader;
    private final DatasetWriter writer;
    private final List<String> temporaryTables = new ArrayList<>();
    private int tableCounter = 0;
    private boolean closed = false;

    public RowStore(DuckDBRuntime runtime) {
        this.executor = new QueryExecutor(Objects.requireNonNull(runtime, "runtime must not be null"));
        this.reader = new DatasetReader(executor);
        this.writer = new DatasetWriter(executor);
    }

    /**
     * Loads a file into the store, detecting its format from the extension.
     *
     * @param path the input file
     * @return a view over every row of the file, in file order
     */
    public LogicalPlan register(Path path) {
        return register(path, FileFormat.fromPath(path));
    }

    /**
     * Loads a file of a known format into the store.
     *
     * @param path the input file
     * @param format the file format
     * @return a view over every row of the file, in file order
     */
    public LogicalPlan register(Path path, FileFormat format) {
        LogicalPlan view = registerQuery(reader.selectAll(path, format));
        logger.debug("Registered {} as {}", path, view);
        return view;
    }

    /**
     * Loads the result of an arbitrary query into the store. Row identity
     * follows the order in which the query produces its rows and is stored
     * in the order column at load time.
     *
     * @param sql the SELECT statement
     * @return a view over the loaded rows
     * @throws InvalidArgumentException if the query already has a column
     *         named like the order column
     */
    public LogicalPlan registerQuery(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");
        for (String column : executor.columnNames(sql)) {
            if (column.equalsIgnoreCase(LogicalPlan.ORDER_COLUMN)) {
                throw new InvalidArgumentException(
                    "Column name '" + column + "' is reserved for row positions; rename it in the input");
            }
        }
        String table = nextTableName(SOURCE_PREFIX);
        executor.executeUpdate(String.format(
            "CREATE TEMP TABLE %s AS SELECT *, row_number() OVER () - 1 AS %s FROM (%s) AS loaded",
            quoteIdentifier(table), quoteIdentifier(LogicalPlan.ORDER_COLUMN), sql));
        temporaryTables.add(table);
        return new SourceTable(table);
    }

    /**
     * Counts the rows of a view.
     *
     * @param view the view
     * @return number of rows
     */
    public long count(LogicalPlan view) {
        return executor.queryForLong(new SQLGenerator().generateCount(view));
    }

    /**
     * Returns the data column names of a view, without the hidden order column.
     *
     * @param view the view
     * @return column names in schema order
     */
    public List<String> columns(LogicalPlan view) {
        List<String> columns = new ArrayList<>(executor.columnNames(new SQLGenerator().generate(view)));
        columns.remove(LogicalPlan.ORDER_COLUMN);
        return Collections.unmodifiableList(columns);
    }

    /**
     * Resolves a user-supplied column name against a view's schema.
     *
     * <p>Surrounding double quotes are stripped. An exact match wins;
     * otherwise the first case-insensitive match is used.
     *
     * @param view the view
     * @param requested the column name as given by the user
     * @return the column name as it appears in the schema
     * @throws ColumnNotFoundException if no column matches
     */
    public String resolveColumn(LogicalPlan view, String requested) {
        Objects.requireNonNull(requested, "requested must not be null");
        String name = requested.trim();
        if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
            name = name.substring(1, name.length() - 1);
        }

        List<String> available = columns(view);
        if (available.contains(name)) {
            return name;
        }
        for (String column : available) {
            if (column.equalsIgnoreCase(name)) {
                return column;
            }
        }
        throw new ColumnNotFoundException(requested, available);
    }

    /**
     * Counts rows per category: the string form of every non-null value of
     * a column.
     *
     * @param view the view
     * @param column the resolved column name
     * @return category populations, sorted by category key
     * @throws StatisticsException if the distinct/count query fails
     */
    public SortedMap<String, Long> categoryCounts(LogicalPlan view, String column) {
        SQLGenerator generator = new SQLGenerator();
        String col = quoteIdentifier(column);
        String sql = String.format(
            "SELECT CAST(%s AS VARCHAR) AS category, COUNT(*) AS population FROM (%s) AS %s " +
            "WHERE %s IS NOT NULL GROUP BY 1",
            col, generator.generate(view), generator.generateSubqueryAlias(), col);

        QueryResult result;
        try {
            result = executor.executeQuery(sql);
        } catch (QueryExecutionException e) {
            throw new StatisticsException(
                "Failed to compute category counts for column '" + column + "': " + e.getMessage(), e, sql);
        }

        SortedMap<String, Long> populations = new TreeMap<>();
        for (List<Object> row : result.rows()) {
            populations.put((String) row.get(0), ((Number) row.get(1)).longValue());
        }
        logger.debug("Column '{}' has {} categories", column, populations.size());
        return Collections.unmodifiableSortedMap(populations);
    }

    /**
     * Materializes every row of a view in its row order.
     *
     * @param view the view
     * @return the rows, without the hidden order column
     */
    public QueryResult collect(LogicalPlan view) {
        return executor.executeQuery(new SQLGenerator().generateOutput(view));
    }

    /**
     * Materializes at most {@code maxRows} leading rows of a view.
     *
     * @param view the view
     * @param maxRows maximum number of rows
     * @return the rows, without the hidden order column
     */
    public QueryResult collect(LogicalPlan view, long maxRows) {
        return collect(new Limit(view, 0, maxRows));
    }

    /**
     * Evaluates a view once into a temporary table, so that later reads
     * observe exactly the same rows in the same order.
     *
     * @param view the view
     * @return a view over the stored result
     */
    public LogicalPlan materialize(LogicalPlan view) {
        String table = nextTableName(MATERIALIZED_PREFIX);
        executor.executeUpdate(String.format("CREATE TEMP TABLE %s AS %s",
            quoteIdentifier(table), new SQLGenerator().generate(view)));
        temporaryTables.add(table);
        return new MaterializedView(table);
    }

    /**
     * Stores a permutation as {@code (old_pos, new_pos)} pairs in a new
     * temporary table, inserting at most {@code batchSize} pairs per statement.
     *
     * @param permutation the permutation
     * @param batchSize pairs per INSERT statement
     * @return the mapping table name
     */
    public String createMappingTable(Permutation permutation, int batchSize) {
        Objects.requireNonNull(permutation, "permutation must not be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got: " + batchSize);
        }

        String table = nextTableName(MAPPING_PREFIX);
        String quoted = quoteIdentifier(table);
        executor.executeUpdate(String.format("CREATE TEMP TABLE %s (old_pos BIGINT, new_pos BIGINT)", quoted));
        temporaryTables.add(table);

        int n = permutation.size();
        int batches = 0;
        for (int start = 0; start < n; start += batchSize) {
            int end = Math.min(n, start + batchSize);
            StringBuilder insert = new StringBuilder("INSERT INTO ").append(quoted).append(" VALUES ");
            for (int newPos = start; newPos < end; newPos++) {
                if (newPos > start) {
                    insert.append(", ");
                }
                insert.append('(').append(permutation.sourceOf(newPos)).append(", ").append(newPos).append(')');
            }
            executor.executeUpdate(insert.toString());
            batches++;
        }
        logger.debug("Created mapping table {} with {} pairs in {} batches", table, n, batches);
        return table;
    }

    /**
     * Writes every row of a view, in its row order, to a file.
     *
     * @param view the view
     * @param path the output file
     * @param format the output format
     */
    public void write(LogicalPlan view, Path path, FileFormat format) {
        writer.write(new SQLGenerator().generateOutput(view), path, format);
    }

    /**
     * Returns the names of the temporary tables currently owned by the store.
     *
     * @return table names, in creation order
     */
    public List<String> temporaryTables() {
        return Collections.unmodifiableList(temporaryTables);
    }

    public QueryExecutor getExecutor() {
        return executor;
    }

    /**
     * Drops every temporary table created through this store.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        if (executor.getRuntime().isClosed()) {
            // temporary tables die with the connection
            temporaryTables.clear();
            return;
        }
        for (int i = temporaryTables.size() - 1; i >= 0; i--) {
            String table = temporaryTables.get(i);
            try {
                executor.executeUpdate("DROP TABLE IF EXISTS " + quoteIdentifier(table));
            } catch (QueryExecutionException e) {
                logger.error("Error dropping temporary table {}", table, e);
            }
        }
        logger.debug("Dropped {} temporary tables", temporaryTables.size());
        temporaryTables.clear();
    }

    private String nextTableName(String prefix) {
        if (closed) {
            throw new IllegalStateException("Row store is closed");
        }
        return prefix + (++tableCounter);
    }
}

package com.splitduck.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fully materialized result of a query: column names plus rows of JDBC
 * values in result order.
 *
 * <p>Only used for small results (category counts, console previews and
 * tests); bulk data never leaves the engine except through the writer.
 */
public final class QueryResult {

    private final List<String> columnNames;
    private final List<List<Object>> rows;

    public QueryResult(List<String> columnNames, List<List<Object>> rows) {
        this.columnNames = List.copyOf(Objects.requireNonNull(columnNames, "columnNames must not be null"));
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            // values may be null, so List.copyOf is not an option
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * Returns the index of a column by exact name.
     *
     * @param name the column name
     * @return the column index
     * @throws IllegalArgumentException if the column does not exist
     */
    public int columnIndex(String name) {
        int index = columnNames.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("No column '" + name + "' in result " + columnNames);
        }
        return index;
    }

    /**
     * Returns all values of one column, in row order.
     *
     * @param name the column name
     * @return the column values
     */
    public List<Object> column(String name) {
        int index = columnIndex(name);
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    @Override
    public String toString() {
        return "QueryResult(columns=" + columnNames + ", rows=" + rows.size() + ")";
    }
}

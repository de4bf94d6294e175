package com.splitduck.cli;

import com.splitduck.runtime.QueryResult;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints query results in a tabular format.
 */
final class ResultPrinter {

    static final int MAX_ROWS = 100;

    private ResultPrinter() {}

    /**
     * Prints up to {@value #MAX_ROWS} rows followed by the total row count.
     *
     * @param result the leading rows of the view
     * @param totalRows number of rows in the whole view
     * @param out the destination
     */
    static void print(QueryResult result, long totalRows, PrintStream out) {
        List<String> columns = result.columnNames();

        for (int i = 0; i < columns.size(); i++) {
            out.print(columns.get(i));
            if (i < columns.size() - 1) {
                out.print("\t| ");
            }
        }
        out.println();

        for (int i = 0; i < columns.size(); i++) {
            out.print("----------------");
            if (i < columns.size() - 1) {
                out.print("-+-");
            }
        }
        out.println();

        if (totalRows == 0) {
            out.println("(No results)");
            return;
        }

        int shown = Math.min(result.rowCount(), MAX_ROWS);
        for (int row = 0; row < shown; row++) {
            List<Object> values = result.rows().get(row);
            for (int col = 0; col < values.size(); col++) {
                Object value = values.get(col);
                out.print(value != null ? value.toString() : "NULL");
                if (col < values.size() - 1) {
                    out.print("\t| ");
                }
            }
            out.println();
        }

        if (totalRows > shown) {
            out.println("... (" + (totalRows - shown) + " more rows)");
        }

        out.println("\nTotal rows: " + totalRows);
    }
}

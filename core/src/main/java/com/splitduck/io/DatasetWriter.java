package com.splitduck.io;

import com.splitduck.exception.QueryExecutionException;
import com.splitduck.runtime.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteFilePath;

/**
 * Writes query results to files using DuckDB's native COPY statement.
 *
 * <p>Output options per format:
 * <ul>
 *   <li>Parquet: Snappy compression</li>
 *   <li>CSV: header row, comma delimiter</li>
 *   <li>JSON: newline-delimited objects</li>
 *   <li>Excel: single sheet with header row</li>
 * </ul>
 *
 * <p>COPY overwrites an existing file. Each call is independent: a failure
 * while writing one file leaves files written by earlier calls in place.
 *
 * <p>Example usage:
 * <pre>
 *   DatasetWriter writer = new DatasetWriter(executor);
 *   writer.write("SELECT * FROM t ORDER BY id", Path.of("out/train.csv"), FileFormat.CSV);
 * </pre>
 *
 * @see DatasetReader
 */
public class DatasetWriter {

    private static final Logger logger = LoggerFactory.getLogger(DatasetWriter.class);

    private final QueryExecutor executor;
    private final ExcelExtension excel;

    /**
     * Creates a writer with the specified query executor.
     *
     * @param executor the query executor
     * @throws NullPointerException if executor is null
     */
    public DatasetWriter(QueryExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.excel = new ExcelExtension(executor);
    }

    /**
     * Writes the result of a query to a file.
     *
     * @param sql the SQL query; its ORDER BY determines the row order in the file
     * @param outputPath the output file path
     * @param format the output format
     * @throws QueryExecutionException if the COPY statement fails
     * @throws com.splitduck.exception.UnsupportedFormatException if Excel
     *         output is requested and the excel extension cannot be loaded
     */
    public void write(String sql, Path outputPath, FileFormat format) {
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(outputPath, "outputPath must not be null");
        Objects.requireNonNull(format, "format must not be null");

        if (format == FileFormat.EXCEL) {
            excel.ensureLoaded();
        }

        String copySQL = String.format("COPY (%s) TO %s (%s)",
            sql, quoteFilePath(outputPath.toString()), copyOptions(format));
        executor.executeUpdate(copySQL);
        logger.debug("Wrote {} to {}", format, outputPath);
    }

    /**
     * Returns the COPY options for a format.
     */
    static String copyOptions(FileFormat format) {
        switch (format) {
            case PARQUET:
                return "FORMAT PARQUET, COMPRESSION SNAPPY";
            case CSV:
                return "FORMAT CSV, HEADER true";
            case JSON:
                return "FORMAT JSON";
            case EXCEL:
                return "FORMAT xlsx, HEADER true";
            default:
                throw new IllegalArgumentException("Unsupported output format: " + format);
        }
    }
}

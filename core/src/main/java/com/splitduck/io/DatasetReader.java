package com.splitduck.io;

import com.splitduck.exception.UnsupportedFormatException;
import com.splitduck.runtime.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

import static com.splitduck.generator.SQLQuoting.quoteFilePath;

/**
 * Builds the DuckDB table functions that read an input file.
 *
 * <p>Supported inputs:
 * <ul>
 *   <li>Parquet: {@code read_parquet('file.parquet')}</li>
 *   <li>CSV: {@code read_csv('file.csv', auto_detect = true)}</li>
 *   <li>JSON / NDJSON: {@code read_json_auto('file.json')}</li>
 *   <li>Excel: {@code read_xlsx('file.xlsx')}, after loading the excel extension</li>
 * </ul>
 *
 * @see DatasetWriter
 */
public class DatasetReader {

    private static final Logger logger = LoggerFactory.getLogger(DatasetReader.class);

    private final ExcelExtension excel;

    public DatasetReader(QueryExecutor executor) {
        this.excel = new ExcelExtension(Objects.requireNonNull(executor, "executor must not be null"));
    }

    /**
     * Returns a SELECT statement producing every row of the file, in file order.
     *
     * @param path the input file
     * @param format the input format
     * @return the SELECT statement
     * @throws UnsupportedFormatException if Excel input is requested and the
     *         excel extension cannot be loaded
     */
    public String selectAll(Path path, FileFormat format) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(format, "format must not be null");

        String file = quoteFilePath(path.toString());
        String source;
        switch (format) {
            case PARQUET:
                source = "read_parquet(" + file + ")";
                break;
            case CSV:
                source = "read_csv(" + file + ", auto_detect = true)";
                break;
            case JSON:
                source = "read_json_auto(" + file + ")";
                break;
            case EXCEL:
                excel.ensureLoaded();
                source = "read_xlsx(" + file + ")";
                break;
            default:
                throw new UnsupportedFormatException("Unsupported input format: " + format);
        }
        logger.debug("Reading {} as {}", path, format);
        return "SELECT * FROM " + source;
    }
}

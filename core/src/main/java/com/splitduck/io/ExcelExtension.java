package com.splitduck.io;

import com.splitduck.exception.QueryExecutionException;
import com.splitduck.exception.UnsupportedFormatException;
import com.splitduck.runtime.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads DuckDB's excel extension on first use. Installing may download the
 * extension, so it is only attempted when an Excel file is actually read
 * or written.
 */
final class ExcelExtension {

    private static final Logger logger = LoggerFactory.getLogger(ExcelExtension.class);

    private final QueryExecutor executor;
    private boolean loaded = false;

    ExcelExtension(QueryExecutor executor) {
        this.executor = executor;
    }

    void ensureLoaded() {
        if (loaded) {
            return;
        }
        try {
            executor.execute("INSTALL excel");
            executor.execute("LOAD excel");
            loaded = true;
            logger.debug("DuckDB excel extension loaded");
        } catch (QueryExecutionException e) {
            throw new UnsupportedFormatException(
                "Excel support is unavailable: the DuckDB excel extension could not be loaded", e);
        }
    }
}

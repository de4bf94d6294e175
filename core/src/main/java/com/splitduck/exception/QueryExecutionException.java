package com.splitduck.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when a row store query or statement fails.
 *
 * <p>This exception wraps SQLException with the failed SQL and provides
 * user-friendly messages for the DuckDB errors users actually hit when
 * pointing the tool at a file.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Input file missing or unreadable</li>
 *   <li>Output directory not writable</li>
 *   <li>Memory limit exceeded</li>
 *   <li>Malformed CSV/JSON input</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       long rows = rowStore.count(view);
 *   } catch (QueryExecutionException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed SQL: " + e.getFailedSQL());
 *   }
 * </pre>
 *
 * @see com.splitduck.runtime.QueryExecutor
 */
public class QueryExecutionException extends SplitDuckException {

    private final String failedSQL;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(message);
        this.failedSQL = sql;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    @Override
    public String kind() {
        return "Query execution failed";
    }

    @Override
    public boolean isUserError() {
        return false;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Translates technical DuckDB error messages into actionable
     * guidance.
     *
     * @return user-friendly error message
     */
    @Override
    public String getUserMessage() {
        String message = getMessage();

        if (message == null) {
            return "Query execution failed. Check the input file and options.";
        }

        if (message.contains("Out of Memory Error")) {
            return "Operation requires more memory than available. " +
                   "Try lowering --jobs or raising the memory limit.";
        }

        if (message.contains("Conversion Error")) {
            return translateConversionError(message);
        }

        if (message.contains("IO Error")) {
            return translateIOError(message);
        }

        if (message.contains("Catalog Error")) {
            return "Table or file error: " + message;
        }

        return "Query execution failed: " + message;
    }

    /**
     * Translates data type conversion errors.
     */
    private String translateConversionError(String message) {
        Pattern pattern = Pattern.compile("Could not convert string \"([^\"]+)\" to '([^']+)'");
        Matcher matcher = pattern.matcher(message);
        if (matcher.find()) {
            return "Cannot convert value '" + matcher.group(1) + "' to type " + matcher.group(2) + ". " +
                   "Check that the input file is well formed.";
        }

        return "Data type mismatch while reading input. Check that the input file is well formed.";
    }

    /**
     * Translates I/O errors.
     */
    private String translateIOError(String message) {
        if (message.contains("No files found") || message.contains("No such file")) {
            return "File not found. Check that file path is correct and file exists.";
        }

        if (message.contains("Permission denied")) {
            return "Permission denied accessing file. " +
                   "Check file permissions and access rights.";
        }

        return "I/O error: " + message;
    }

    @Override
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}

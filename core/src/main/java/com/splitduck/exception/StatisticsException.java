package com.splitduck.exception;

/**
 * Thrown when the distinct/count query used to compute per-category
 * populations fails in the row store.
 */
public class StatisticsException extends SplitDuckException {

    private final String failedSQL;

    public StatisticsException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the statistics query that failed.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    @Override
    public String kind() {
        return "Statistics error";
    }

    @Override
    public boolean isUserError() {
        return false;
    }

    @Override
    public String getTechnicalMessage() {
        String base = super.getTechnicalMessage();
        return failedSQL == null ? base : base + "Failed SQL:\n" + failedSQL + "\n";
    }
}

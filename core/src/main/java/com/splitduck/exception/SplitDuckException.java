package com.splitduck.exception;

/**
 * Base class for every error raised by the sampling, shuffling and
 * splitting engine.
 *
 * <p>All failures are terminal for the running command: nothing in the
 * engine retries. Subclasses identify the error kind so that callers (the
 * command line in particular) can map it to an exit status and a
 * human-readable message.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       partitioner.split(view, spec, stratifyBy, seed);
 *   } catch (SplitDuckException e) {
 *       System.err.println("Error: " + e.getUserMessage());
 *   }
 * </pre>
 */
public abstract class SplitDuckException extends RuntimeException {

    protected SplitDuckException(String message) {
        super(message);
    }

    protected SplitDuckException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the short name of the error kind (e.g. "Invalid argument").
     *
     * @return the error kind label
     */
    public abstract String kind();

    /**
     * Returns whether the error was caused by user input rather than by the
     * underlying engine.
     *
     * @return true for argument, column, category and format errors
     */
    public boolean isUserError() {
        return true;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return message suitable for stderr
     */
    public String getUserMessage() {
        return kind() + ": " + getMessage();
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind()).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}

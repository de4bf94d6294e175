package com.splitduck.exception;

/**
 * Thrown when a file format cannot be determined from a path, or a format
 * is not available in the running engine.
 */
public class UnsupportedFormatException extends SplitDuckException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "Unsupported format";
    }
}

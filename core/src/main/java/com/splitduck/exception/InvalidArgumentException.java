package com.splitduck.exception;

/**
 * Thrown when a command argument is malformed or inconsistent: bad ratio
 * syntax, ratios that do not sum to 1.0 or 100.0, a name count that does
 * not match the ratio count, a non-positive ratio, or a missing option.
 */
public class InvalidArgumentException extends SplitDuckException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "Invalid argument";
    }
}

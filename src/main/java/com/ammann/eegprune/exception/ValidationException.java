/* (C)2026 */
package com.ammann.eegprune.exception;

/**
 * Exception indicating that a client-supplied recording, event or option does not meet
 * the constraints of the pruning pipeline.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 * Provides factory methods for common validation failure patterns.
 */
public class ValidationException extends PruningException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for a field whose size does not match the recording.
     */
    public static ValidationException sizeMismatch(String field, int expected, int actual) {
        return new ValidationException(
                String.format("Size mismatch for %s: expected %d, but got %d",
                        field, expected, actual));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}

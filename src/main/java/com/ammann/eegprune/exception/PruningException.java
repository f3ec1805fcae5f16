/* (C)2026 */
package com.ammann.eegprune.exception;

/**
 * Base unchecked exception for all fatal errors raised by the pruning core.
 *
 * <p>Subclasses represent specific error categories (invalid spans, excision ranges,
 * request validation, failed pipeline steps) and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}. Recoverable anomalies are never thrown; they travel
 * as warnings next to the result.
 */
public class PruningException extends RuntimeException
{
    public PruningException(String message, Throwable cause) {
        super(message, cause);
    }

    public PruningException(String message) {
        super(message);
    }
}

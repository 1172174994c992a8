package com.openrangelabs.donpetre.issuesync.exception;

/**
 * Base exception for issue synchronization failures.
 *
 * <p>Raised by collaborators of the import engine (remote fetchers, item sinks,
 * durable stores) and by the engine itself when a session cannot proceed.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class SyncException extends RuntimeException {

    /**
     * Constructs a new sync exception with the specified detail message.
     *
     * @param message the detail message
     */
    public SyncException(String message) {
        super(message);
    }

    /**
     * Constructs a new sync exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new sync exception with the specified cause.
     *
     * @param cause the cause
     */
    public SyncException(Throwable cause) {
        super(cause);
    }
}

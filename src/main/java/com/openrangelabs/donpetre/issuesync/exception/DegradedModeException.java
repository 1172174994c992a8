package com.openrangelabs.donpetre.issuesync.exception;

/**
 * Exception thrown when a write operation is attempted while the engine runs in degraded mode.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class DegradedModeException extends SyncException {

    private final String reason;

    public DegradedModeException(String reason) {
        super(String.format("Sync engine is in degraded mode: %s", reason));
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}

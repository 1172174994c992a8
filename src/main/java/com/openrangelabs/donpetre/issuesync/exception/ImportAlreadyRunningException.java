package com.openrangelabs.donpetre.issuesync.exception;

/**
 * Exception thrown when an import is requested while another session is active
 * on the same coordinator.
 *
 * <p>Start requests are never queued; the caller has to wait for the active
 * session to reach a terminal phase.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class ImportAlreadyRunningException extends SyncException {

    private final String activeSessionId;

    /**
     * Constructs a new exception for the given active session.
     *
     * @param activeSessionId the ID of the session currently running
     */
    public ImportAlreadyRunningException(String activeSessionId) {
        super(String.format("Import already in progress: session %s", activeSessionId));
        this.activeSessionId = activeSessionId;
    }

    /**
     * Gets the ID of the session that is currently running.
     *
     * @return the active session ID
     */
    public String getActiveSessionId() {
        return activeSessionId;
    }
}

package com.openrangelabs.donpetre.issuesync.exception;

/**
 * Exception thrown when a resume is requested for a session that has no persisted checkpoint.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class NothingToResumeException extends SyncException {

    private final String sessionId;

    /**
     * Constructs a new exception for the given session.
     *
     * @param sessionId the ID of the session that was asked to resume
     */
    public NothingToResumeException(String sessionId) {
        super(String.format("No import to resume for session: %s", sessionId));
        this.sessionId = sessionId;
    }

    /**
     * Gets the session ID that had no checkpoint.
     *
     * @return the session ID
     */
    public String getSessionId() {
        return sessionId;
    }
}

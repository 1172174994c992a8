package com.openrangelabs.donpetre.issuesync.exception;

/**
 * Exception thrown when the sync engine or one of its collaborators is misconfigured.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class SyncConfigurationException extends SyncException {

    public SyncConfigurationException(String message) {
        super(message);
    }

    public SyncConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

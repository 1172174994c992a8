package com.openrangelabs.donpetre.issuesync.exception;

/**
 * Exception thrown by an item sink when a record cannot be written to the local store.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class LocalWriteException extends SyncException {

    private final String itemKey;

    public LocalWriteException(String itemKey, String message) {
        super(message);
        this.itemKey = itemKey;
    }

    public LocalWriteException(String itemKey, String message, Throwable cause) {
        super(message, cause);
        this.itemKey = itemKey;
    }

    public String getItemKey() {
        return itemKey;
    }
}

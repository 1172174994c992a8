package com.openrangelabs.donpetre.issuesync.exception;

/**
 * Exception thrown when a fetched record has a shape that cannot be imported.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class InvalidItemException extends SyncException {

    private final String itemKey;

    public InvalidItemException(String itemKey, String message) {
        super(message);
        this.itemKey = itemKey;
    }

    public String getItemKey() {
        return itemKey;
    }
}

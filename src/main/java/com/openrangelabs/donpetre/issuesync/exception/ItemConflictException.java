package com.openrangelabs.donpetre.issuesync.exception;

/**
 * Exception thrown by an item sink when the local copy of a record conflicts with the remote one.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class ItemConflictException extends SyncException {

    private final String itemKey;

    public ItemConflictException(String itemKey, String message) {
        super(message);
        this.itemKey = itemKey;
    }

    public String getItemKey() {
        return itemKey;
    }
}

package com.openrangelabs.donpetre.issuesync.importer;

import com.openrangelabs.donpetre.issuesync.model.ProgressEvent;

/**
 * Receives import progress. Called synchronously on the import chain, so
 * implementations should return quickly. Exceptions are logged and ignored.
 */
public interface ImportObserver {

    default void onProgress(ProgressEvent event) {
    }

    default void onItemError(String itemKey, String message) {
    }
}

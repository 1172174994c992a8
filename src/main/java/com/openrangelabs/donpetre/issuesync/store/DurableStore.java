package com.openrangelabs.donpetre.issuesync.store;

import com.openrangelabs.donpetre.issuesync.model.ImportCheckpoint;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence used by the engine for resume checkpoints and deferred operations.
 * Every write must be durable when the returned publisher completes.
 */
public interface DurableStore {

    /**
     * Replaces any previous checkpoint of the same session
     */
    Mono<Void> saveCheckpoint(ImportCheckpoint checkpoint);

    /**
     * @return the checkpoint, or empty when the session has none
     */
    Mono<ImportCheckpoint> loadCheckpoint(String sessionId);

    Mono<Void> clearCheckpoint(String sessionId);

    Mono<DeferredOperation> enqueue(DeferredOperation operation);

    /**
     * Pending deferred operations, oldest first
     */
    Flux<DeferredOperation> pendingOperations();
}

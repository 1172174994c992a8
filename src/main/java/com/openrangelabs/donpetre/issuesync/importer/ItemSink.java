package com.openrangelabs.donpetre.issuesync.importer;

import com.openrangelabs.donpetre.issuesync.model.IssueRecord;
import com.openrangelabs.donpetre.issuesync.model.ItemCounts;
import reactor.core.publisher.Mono;

/**
 * Writes one fetched record into the local store.
 *
 * <p>Implementations must be idempotent: a record can be applied again after a retry or
 * a resume. An error signal is treated as a per-item failure; completing empty counts
 * the record as skipped.
 */
@FunctionalInterface
public interface ItemSink {

    Mono<ItemCounts> apply(IssueRecord record);
}

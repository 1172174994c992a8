package com.openrangelabs.donpetre.issuesync.query;

import com.openrangelabs.donpetre.issuesync.model.IssueRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Consumer of fetched pages. The next page is requested only after the returned
 * publisher completes; an error signal aborts the run.
 */
@FunctionalInterface
public interface PageHandler {

    Mono<Void> onPage(List<IssueRecord> items, long fetchedSoFar, long total);
}

package com.openrangelabs.donpetre.issuesync.query;

import com.openrangelabs.donpetre.issuesync.model.PageResult;
import com.openrangelabs.donpetre.issuesync.model.QuerySpec;
import reactor.core.publisher.Mono;

/**
 * Fetches one page of a remote search
 */
public interface PageFetcher {

    /**
     * @param spec the query
     * @param pageSize items requested for this page
     * @param pageToken continuation token of the previous page, null for the first page
     */
    Mono<PageResult> fetchPage(QuerySpec spec, int pageSize, String pageToken);
}

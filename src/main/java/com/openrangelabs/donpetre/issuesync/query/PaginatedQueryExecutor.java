package com.openrangelabs.donpetre.issuesync.query;

import com.openrangelabs.donpetre.issuesync.fault.ErrorContext;
import com.openrangelabs.donpetre.issuesync.fault.Fault;
import com.openrangelabs.donpetre.issuesync.fault.FaultClassifier;
import com.openrangelabs.donpetre.issuesync.model.ExecutionResult;
import com.openrangelabs.donpetre.issuesync.model.IssueRecord;
import com.openrangelabs.donpetre.issuesync.model.PageResult;
import com.openrangelabs.donpetre.issuesync.model.QuerySpec;
import com.openrangelabs.donpetre.issuesync.recovery.ErrorRecoveryService;
import com.openrangelabs.donpetre.issuesync.recovery.RecoveryOutcome;
import com.openrangelabs.donpetre.issuesync.statistics.SyncStatisticsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Streams the results of a remote search page by page.
 *
 * <p>Pages are fetched strictly one after the other and handed to a {@link PageHandler}.
 * Fetch failures go through classification and recovery: a retry re-issues the same page
 * after the backoff delay, any other outcome ends the run as truncated. Failures raised
 * by the handler are not recovered and terminate the run with that error.
 */
@Component
public class PaginatedQueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(PaginatedQueryExecutor.class);

    private final PageFetcher fetcher;
    private final FaultClassifier classifier;
    private final ErrorRecoveryService recoveryService;
    private final SyncStatisticsAggregator statistics;

    @Autowired
    public PaginatedQueryExecutor(
            PageFetcher fetcher,
            FaultClassifier classifier,
            ErrorRecoveryService recoveryService,
            SyncStatisticsAggregator statistics) {
        this.fetcher = fetcher;
        this.classifier = classifier;
        this.recoveryService = recoveryService;
        this.statistics = statistics;
    }

    public Mono<ExecutionResult> run(QuerySpec spec, PageHandler onPage, CancellationToken token) {
        return Mono.defer(() -> {
            ExecutionState state = new ExecutionState(spec);
            logger.debug("Running query {}", spec);

            return Mono.defer(() -> step(state, onPage, token))
                    .repeat(() -> !state.done)
                    .then(Mono.fromCallable(() -> {
                        ExecutionResult result = state.toResult();
                        logger.debug("Query finished: {}", result);
                        return result;
                    }));
        });
    }

    private Mono<Void> step(ExecutionState state, PageHandler onPage, CancellationToken token) {
        if (token.isCancelled()) {
            state.cancelled = true;
            state.done = true;
            return Mono.empty();
        }

        long remaining = state.spec.getMaxResults() - state.fetched;
        if (remaining <= 0) {
            state.done = true;
            return Mono.empty();
        }

        int pageSize = (int) Math.min(state.spec.getPageSize(), remaining);
        String pageToken = state.pageToken;
        state.apiCalls++;
        statistics.recordApiCalls(1);

        return Mono.defer(() -> fetcher.fetchPage(state.spec, pageSize, pageToken))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Fetcher completed without a page")))
                .onErrorResume(error -> handleFetchError(state, error, token).then(Mono.<PageResult>empty()))
                .flatMap(page -> accept(state, page, onPage));
    }

    private Mono<Void> accept(ExecutionState state, PageResult page, PageHandler onPage) {
        state.attempt = 1;

        long allowed = state.spec.getMaxResults() - state.fetched;
        List<IssueRecord> items = page.getItems();
        boolean dropped = items.size() > allowed;
        if (dropped) {
            items = items.subList(0, (int) allowed);
        }

        state.fetched += items.size();
        state.total = page.hasKnownTotal() ? page.getTotal() : state.fetched;

        boolean exhausted = page.isLast() || page.getNextPageToken() == null || page.getItems().isEmpty();
        boolean capReached = state.fetched >= state.spec.getMaxResults();
        state.pageToken = page.getNextPageToken();

        if (exhausted || capReached) {
            state.done = true;
            state.truncated = dropped || (capReached && !exhausted);
        }

        logger.debug("Page accepted: {} item(s), fetched {} of {}{}",
                items.size(), state.fetched, state.total, state.done ? " (last)" : "");

        if (items.isEmpty()) {
            return Mono.empty();
        }
        return onPage.onPage(items, state.fetched, state.total);
    }

    private Mono<Void> handleFetchError(ExecutionState state, Throwable error, CancellationToken token) {
        Fault fault = classifier.classify(error, ErrorContext.forPageFetch(state.pageToken));

        return recoveryService.recover(fault, state.attempt, state.describePage())
                .flatMap(outcome -> {
                    if (outcome.shouldRetry()) {
                        return retryAfter(state, outcome, token);
                    }
                    logger.warn("Query stopped after {} item(s): {}", state.fetched, fault.getUserMessage());
                    state.faults.add(fault);
                    state.truncated = true;
                    state.done = true;
                    return Mono.empty();
                });
    }

    private Mono<Void> retryAfter(ExecutionState state, RecoveryOutcome outcome, CancellationToken token) {
        return token.sleep(outcome.getRetryDelay())
                .then(Mono.fromRunnable(() -> {
                    if (token.isCancelled()) {
                        state.cancelled = true;
                        state.done = true;
                    } else {
                        state.attempt++;
                    }
                }));
    }

    private static final class ExecutionState {
        private final QuerySpec spec;
        private final List<Fault> faults = new ArrayList<>();
        private long fetched;
        private long total;
        private String pageToken;
        private int attempt = 1;
        private int apiCalls;
        private boolean truncated;
        private boolean cancelled;
        private boolean done;

        private ExecutionState(QuerySpec spec) {
            this.spec = spec;
        }

        private Map<String, Object> describePage() {
            Map<String, Object> page = new LinkedHashMap<>();
            page.put("query", spec.getQuery());
            page.put("resumeAfterKey", spec.getResumeAfterKey());
            page.put("pageToken", pageToken);
            page.put("fetched", fetched);
            return page;
        }

        private ExecutionResult toResult() {
            return ExecutionResult.builder()
                    .itemsFetched(fetched)
                    .total(total)
                    .truncated(truncated)
                    .cancelled(cancelled)
                    .faults(faults)
                    .apiCalls(apiCalls)
                    .build();
        }
    }
}

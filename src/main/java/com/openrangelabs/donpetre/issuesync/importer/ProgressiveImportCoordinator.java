package com.openrangelabs.donpetre.issuesync.importer;

import com.openrangelabs.donpetre.issuesync.config.SyncProperties;
import com.openrangelabs.donpetre.issuesync.exception.DegradedModeException;
import com.openrangelabs.donpetre.issuesync.exception.ImportAlreadyRunningException;
import com.openrangelabs.donpetre.issuesync.exception.NothingToResumeException;
import com.openrangelabs.donpetre.issuesync.fault.ErrorContext;
import com.openrangelabs.donpetre.issuesync.fault.Fault;
import com.openrangelabs.donpetre.issuesync.fault.FaultClassifier;
import com.openrangelabs.donpetre.issuesync.fault.RecoveryStrategy;
import com.openrangelabs.donpetre.issuesync.model.ExecutionResult;
import com.openrangelabs.donpetre.issuesync.model.ImportCheckpoint;
import com.openrangelabs.donpetre.issuesync.model.ImportPhase;
import com.openrangelabs.donpetre.issuesync.model.ImportSummary;
import com.openrangelabs.donpetre.issuesync.model.IssueRecord;
import com.openrangelabs.donpetre.issuesync.model.ItemCounts;
import com.openrangelabs.donpetre.issuesync.model.ItemFailure;
import com.openrangelabs.donpetre.issuesync.model.ProgressEvent;
import com.openrangelabs.donpetre.issuesync.model.QuerySpec;
import com.openrangelabs.donpetre.issuesync.query.PaginatedQueryExecutor;
import com.openrangelabs.donpetre.issuesync.recovery.DegradedModeState;
import com.openrangelabs.donpetre.issuesync.recovery.ErrorRecoveryService;
import com.openrangelabs.donpetre.issuesync.recovery.RecoveryOutcome;
import com.openrangelabs.donpetre.issuesync.statistics.SyncStatisticsAggregator;
import com.openrangelabs.donpetre.issuesync.store.DurableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a potentially huge query result into bounded, resumable chunks of work.
 *
 * <p>Fetched records are buffered across page boundaries and applied in chunks of
 * {@code batchSize}, one record at a time. A checkpoint is written after every chunk, so
 * a paused, cancelled or failed session can be resumed from the last handled record.
 * Only one session may be active per coordinator.
 */
@Service
public class ProgressiveImportCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ProgressiveImportCoordinator.class);

    private final SyncProperties properties;
    private final PaginatedQueryExecutor executor;
    private final DurableStore durableStore;
    private final FaultClassifier classifier;
    private final ErrorRecoveryService recoveryService;
    private final SyncStatisticsAggregator statistics;
    private final DegradedModeState degradedMode;
    private final List<ImportObserver> observers;
    private final Clock clock;
    private final ActiveSessionGuard guard = new ActiveSessionGuard();

    @Autowired
    public ProgressiveImportCoordinator(
            SyncProperties properties,
            PaginatedQueryExecutor executor,
            DurableStore durableStore,
            FaultClassifier classifier,
            ErrorRecoveryService recoveryService,
            SyncStatisticsAggregator statistics,
            DegradedModeState degradedMode,
            List<ImportObserver> observers,
            Clock clock) {

        this.properties = properties;
        this.executor = executor;
        this.durableStore = durableStore;
        this.classifier = classifier;
        this.recoveryService = recoveryService;
        this.statistics = statistics;
        this.degradedMode = degradedMode;
        this.observers = List.copyOf(observers);
        this.clock = clock;
    }

    /**
     * Starts a new import session for the JQL with the configured query and batch settings
     */
    public Mono<ImportSummary> start(String jql, ItemSink sink) {
        return Mono.defer(() -> start(properties.newQuery(jql), properties.getImporter().getBatchSize(), sink));
    }

    /**
     * Starts a new import session.
     *
     * <p>Fails with {@link ImportAlreadyRunningException} while another session is active
     * and with {@link DegradedModeException} while the engine is degraded. Once started,
     * the returned summary is emitted whatever the terminal phase.
     */
    public Mono<ImportSummary> start(QuerySpec spec, int batchSize, ItemSink sink) {
        return Mono.defer(() -> {
            if (batchSize <= 0) {
                return Mono.error(new IllegalArgumentException("Batch size must be positive: " + batchSize));
            }
            if (degradedMode.isDegraded()) {
                return Mono.error(new DegradedModeException(degradedMode.getReason()));
            }

            ImportSession session = ImportSession.start(UUID.randomUUID().toString(), spec, batchSize, clock.instant());
            ImportRun run = new ImportRun(session, sink);
            guard.acquire(run);

            logger.info("Starting import {} for {} (batch size {})", session.getSessionId(), spec, batchSize);
            session.transitionTo(ImportPhase.FETCHING);
            notifyProgress(run, "fetching");

            return execute(run, spec).doFinally(signal -> guard.release(run));
        });
    }

    /**
     * Resumes a session from its last checkpoint, under the same session id
     */
    public Mono<ImportSummary> resume(String sessionId, ItemSink sink) {
        return Mono.defer(() -> {
            if (degradedMode.isDegraded()) {
                return Mono.error(new DegradedModeException(degradedMode.getReason()));
            }
            ImportRun active = guard.current();
            if (active != null) {
                return Mono.error(new ImportAlreadyRunningException(active.session().getSessionId()));
            }

            return durableStore.loadCheckpoint(sessionId)
                    .switchIfEmpty(Mono.error(() -> new NothingToResumeException(sessionId)))
                    .flatMap(checkpoint -> resumeFrom(checkpoint, sink));
        });
    }

    private Mono<ImportSummary> resumeFrom(ImportCheckpoint checkpoint, ItemSink sink) {
        ImportSession session = ImportSession.restore(checkpoint, clock.instant());
        ImportRun run = new ImportRun(session, sink);
        guard.acquire(run);

        session.transitionTo(ImportPhase.RESUMING);
        logger.info("Resuming import {} after {} ({} already processed)",
                session.getSessionId(), checkpoint.getLastItemKey(), checkpoint.getProcessedCount());
        notifyProgress(run, "resuming after " + checkpoint.getLastItemKey());

        QuerySpec base = checkpoint.getQuery();
        QuerySpec query = checkpoint.getLastItemKey() != null ? base.resumingAfter(checkpoint.getLastItemKey()) : base;
        int remainingCap = (int) Math.max(0, base.getMaxResults() - checkpoint.getProcessedCount());

        return execute(run, query.withMaxResults(remainingCap)).doFinally(signal -> guard.release(run));
    }

    /**
     * Asks the active session to pause after its current chunk.
     *
     * @return false when no session is active
     */
    public boolean pause() {
        return requestStop(ImportRun.StopReason.PAUSE);
    }

    /**
     * Asks the active session to stop after its current chunk and end as cancelled.
     * The checkpoint is kept.
     *
     * @return false when no session is active
     */
    public boolean cancel() {
        return requestStop(ImportRun.StopReason.CANCEL);
    }

    public Optional<ImportSession> getActiveSession() {
        return Optional.ofNullable(guard.current()).map(ImportRun::session);
    }

    private boolean requestStop(ImportRun.StopReason reason) {
        ImportRun run = guard.current();
        if (run == null) {
            return false;
        }
        logger.info("{} requested for import {}", reason, run.session().getSessionId());
        run.requestStop(reason);
        return true;
    }

    private Mono<ImportSummary> execute(ImportRun run, QuerySpec query) {
        ImportSession session = run.session();

        return executor.run(query, (items, fetchedSoFar, total) -> onPage(run, items, total), run.token())
                .flatMap(result -> finish(run, result))
                .onErrorResume(error -> fail(run, error))
                .doOnNext(summary -> logger.info("Import {} finished: {}", session.getSessionId(), summary));
    }

    private Mono<Void> onPage(ImportRun run, List<IssueRecord> items, long total) {
        ImportSession session = run.session();
        session.refineTotal(total);

        List<List<IssueRecord>> chunks = run.bufferAndDrainChunks(items, session.getBatchSize());
        return Flux.fromIterable(chunks)
                .concatMap(chunk -> processChunk(run, chunk))
                .then();
    }

    private Mono<Void> processChunk(ImportRun run, List<IssueRecord> chunk) {
        return Mono.defer(() -> {
            ImportSession session = run.session();
            if (run.isStopRequested()) {
                return Mono.empty();
            }
            if (degradedMode.isDegraded()) {
                logger.warn("Degraded mode active, stopping import {} before next chunk", session.getSessionId());
                run.requestStop(ImportRun.StopReason.DEGRADED);
                return Mono.empty();
            }
            if (session.getPhase() != ImportPhase.IMPORTING) {
                session.transitionTo(ImportPhase.IMPORTING);
            }

            return Flux.fromIterable(chunk)
                    .concatMap(item -> applyItem(run, item, 1))
                    .then(Mono.defer(() -> durableStore.saveCheckpoint(session.toCheckpoint(clock.instant()))))
                    .then(Mono.fromRunnable(() -> {
                        session.chunkCompleted();
                        logger.debug("Chunk {} of import {} done ({} items)",
                                session.getChunks(), session.getSessionId(), chunk.size());
                        notifyProgress(run, null);
                    }));
        });
    }

    private Mono<Void> applyItem(ImportRun run, IssueRecord item, int attempt) {
        return Mono.defer(() -> {
            long startedAt = clock.millis();
            return Mono.defer(() -> run.sink().apply(item))
                    .defaultIfEmpty(ItemCounts.skipped())
                    .doOnNext(counts -> {
                        run.session().recordSuccess(item.getKey(), counts);
                        statistics.recordSuccess(clock.millis() - startedAt, counts);
                    })
                    .then()
                    .onErrorResume(error -> handleItemError(run, item, attempt, error));
        });
    }

    private Mono<Void> handleItemError(ImportRun run, IssueRecord item, int attempt, Throwable error) {
        Fault fault = classifier.classify(error, ErrorContext.forItem(item.getKey()));

        return recoveryService.recover(fault, attempt, item)
                .flatMap(outcome -> {
                    if (outcome.shouldRetry()) {
                        return run.token().sleep(outcome.getRetryDelay())
                                .then(Mono.defer(() -> applyItem(run, item, attempt + 1)));
                    }
                    if (outcome.isSuccess() && outcome.getStrategy() == RecoveryStrategy.FALLBACK) {
                        run.session().recordSuccess(item.getKey(), ItemCounts.skipped());
                        return Mono.empty();
                    }
                    recordItemFailure(run, item, fault, outcome);
                    return Mono.empty();
                });
    }

    private void recordItemFailure(ImportRun run, IssueRecord item, Fault fault, RecoveryOutcome outcome) {
        ImportSession session = run.session();
        session.recordFailure(new ItemFailure(item.getKey(), fault.getMessage(), fault.getCategory(),
                outcome.getStrategy(), outcome.isDeferred(), clock.instant()));
        if (!outcome.isSuccess()) {
            session.addFault(fault);
        }
        for (ImportObserver observer : observers) {
            try {
                observer.onItemError(item.getKey(), fault.getUserMessage());
            } catch (RuntimeException e) {
                logger.warn("Import observer {} failed on item error: {}",
                        observer.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private Mono<ImportSummary> finish(ImportRun run, ExecutionResult result) {
        ImportSession session = run.session();

        Mono<Void> flush = Mono.defer(() -> {
            List<IssueRecord> rest = run.drainRemainder();
            if (rest.isEmpty() || run.isStopRequested()) {
                return Mono.empty();
            }
            return processChunk(run, rest);
        });

        return flush.then(Mono.defer(() -> {
            result.getFaults().forEach(session::addFault);
            ImportPhase terminal = terminalPhase(run, session);

            Mono<Void> checkpointAction = checkpointActionFor(terminal, session);

            return checkpointAction.then(Mono.fromCallable(() -> {
                session.transitionTo(terminal);
                if (terminal == ImportPhase.ERROR) {
                    logger.error("Import {} ended with {} unrecovered fault(s)",
                            session.getSessionId(), session.getFaults().size());
                }
                notifyProgress(run, null);
                return summarize(run);
            }));
        }));
    }

    /**
     * Clears the checkpoint of a completed session. A stopped session always gets one,
     * even when no chunk finished before the stop, so that it can be resumed.
     */
    private Mono<Void> checkpointActionFor(ImportPhase terminal, ImportSession session) {
        if (terminal == ImportPhase.COMPLETE) {
            return durableStore.clearCheckpoint(session.getSessionId());
        }
        if (terminal == ImportPhase.PAUSED || terminal == ImportPhase.CANCELLED) {
            return Mono.defer(() -> durableStore.saveCheckpoint(session.toCheckpoint(clock.instant())));
        }
        return Mono.empty();
    }

    private ImportPhase terminalPhase(ImportRun run, ImportSession session) {
        ImportRun.StopReason reason = run.stopReason();
        if (reason == ImportRun.StopReason.CANCEL) {
            return ImportPhase.CANCELLED;
        }
        if (reason != null) {
            return ImportPhase.PAUSED;
        }
        if (!session.getFaults().isEmpty()) {
            return ImportPhase.ERROR;
        }
        return ImportPhase.COMPLETE;
    }

    private Mono<ImportSummary> fail(ImportRun run, Throwable error) {
        ImportSession session = run.session();
        Fault fault = classifier.classify(error, ErrorContext.forOperation(ErrorContext.IMPORT_SESSION));
        session.addFault(fault);
        if (session.getPhase().canTransitionTo(ImportPhase.ERROR)) {
            session.transitionTo(ImportPhase.ERROR);
        }
        logger.error("Import {} failed: {}", session.getSessionId(), fault.getUserMessage(), error);
        notifyProgress(run, fault.getUserMessage());
        return Mono.just(summarize(run));
    }

    private ImportSummary summarize(ImportRun run) {
        ImportSession session = run.session();
        return ImportSummary.builder(session.getSessionId())
                .phase(session.getPhase())
                .counts(session.getCounts())
                .failed(session.getFailed())
                .processed(session.getProcessed())
                .total(session.getTotal())
                .chunks(session.getChunks())
                .elapsed(Duration.between(session.getStartedAt(), clock.instant()))
                .failures(session.getFailures())
                .faults(session.getFaults())
                .resumedFrom(session.getResumedFrom())
                .cancelled(run.isStopRequested())
                .build();
    }

    private void notifyProgress(ImportRun run, String detail) {
        ImportSession session = run.session();
        ProgressEvent event = ProgressEvent.builder()
                .sessionId(session.getSessionId())
                .phase(session.getPhase())
                .processed(session.getProcessed())
                .total(session.getTotal())
                .chunks(session.getChunks())
                .detail(detail)
                .build();
        for (ImportObserver observer : observers) {
            try {
                observer.onProgress(event);
            } catch (RuntimeException e) {
                logger.warn("Import observer {} failed on progress: {}",
                        observer.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}

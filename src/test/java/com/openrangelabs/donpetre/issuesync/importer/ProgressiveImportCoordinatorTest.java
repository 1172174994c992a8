package com.openrangelabs.donpetre.issuesync.importer;

import com.openrangelabs.donpetre.issuesync.exception.DegradedModeException;
import com.openrangelabs.donpetre.issuesync.exception.ImportAlreadyRunningException;
import com.openrangelabs.donpetre.issuesync.exception.InvalidItemException;
import com.openrangelabs.donpetre.issuesync.exception.ItemConflictException;
import com.openrangelabs.donpetre.issuesync.exception.LocalWriteException;
import com.openrangelabs.donpetre.issuesync.exception.NothingToResumeException;
import com.openrangelabs.donpetre.issuesync.exception.SyncConfigurationException;
import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;
import com.openrangelabs.donpetre.issuesync.model.ImportCheckpoint;
import com.openrangelabs.donpetre.issuesync.model.ImportPhase;
import com.openrangelabs.donpetre.issuesync.model.ImportSummary;
import com.openrangelabs.donpetre.issuesync.model.IssueRecord;
import com.openrangelabs.donpetre.issuesync.model.ItemCounts;
import com.openrangelabs.donpetre.issuesync.model.ProgressEvent;
import com.openrangelabs.donpetre.issuesync.model.QuerySpec;
import com.openrangelabs.donpetre.issuesync.support.FakePageFetcher;
import com.openrangelabs.donpetre.issuesync.support.TestEngine;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressiveImportCoordinatorTest {

    private static final QuerySpec QUERY = QuerySpec.builder("project = ABC").pageSize(50).build();

    private final List<String> appliedKeys = new CopyOnWriteArrayList<>();

    private ItemSink creatingSink() {
        return record -> Mono.fromCallable(() -> {
            appliedKeys.add(record.getKey());
            return ItemCounts.created();
        });
    }

    private ItemSink failingSink(Set<String> keys, Function<String, RuntimeException> failure) {
        return record -> {
            if (keys.contains(record.getKey())) {
                return Mono.error(failure.apply(record.getKey()));
            }
            appliedKeys.add(record.getKey());
            return Mono.just(ItemCounts.created());
        };
    }

    private static final class RecordingObserver implements ImportObserver {
        private final List<ProgressEvent> events = new ArrayList<>();
        private final List<String> itemErrors = new ArrayList<>();
        private Consumer<ProgressEvent> hook = event -> { };

        @Override
        public void onProgress(ProgressEvent event) {
            events.add(event);
            hook.accept(event);
        }

        @Override
        public void onItemError(String itemKey, String message) {
            itemErrors.add(itemKey);
        }

        List<Long> importingProgress() {
            return events.stream()
                    .filter(event -> event.getPhase() == ImportPhase.IMPORTING)
                    .map(ProgressEvent::getProcessed)
                    .toList();
        }
    }

    @Test
    void start_AllItemsSucceed_ImportsInChunksAndCompletes() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(63));
        RecordingObserver observer = new RecordingObserver();
        ProgressiveImportCoordinator coordinator = engine.coordinator(observer);

        // Act & Assert
        StepVerifier.create(coordinator.start(QUERY, 25, creatingSink()))
                .assertNext(summary -> {
                    assertThat(summary.getPhase()).isEqualTo(ImportPhase.COMPLETE);
                    assertThat(summary.getImported()).isEqualTo(63);
                    assertThat(summary.getCreated()).isEqualTo(63);
                    assertThat(summary.getProcessed()).isEqualTo(63);
                    assertThat(summary.getTotal()).isEqualTo(63);
                    assertThat(summary.getChunks()).isEqualTo(3);
                    assertThat(summary.getFailed()).isZero();
                    assertThat(summary.hasErrors()).isFalse();
                    assertThat(summary.isCancelled()).isFalse();
                    assertThat(engine.store.loadCheckpoint(summary.getSessionId()).block()).isNull();
                })
                .verifyComplete();

        assertThat(observer.importingProgress()).containsExactly(25L, 50L, 63L);
        assertThat(observer.events.get(observer.events.size() - 1).getPhase()).isEqualTo(ImportPhase.COMPLETE);
        assertThat(appliedKeys).hasSize(63).startsWith(FakePageFetcher.key(1)).endsWith(FakePageFetcher.key(63));
        assertThat(engine.store.getCheckpointWrites()).isEqualTo(3);
        assertThat(coordinator.getActiveSession()).isEmpty();
    }

    @Test
    void start_WithJqlOnly_UsesConfiguredBatchSize() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(30));
        engine.properties.getImporter().setBatchSize(10);
        ProgressiveImportCoordinator coordinator = engine.coordinator();

        // Act & Assert
        StepVerifier.create(coordinator.start("project = ABC", creatingSink()))
                .assertNext(summary -> {
                    assertThat(summary.getPhase()).isEqualTo(ImportPhase.COMPLETE);
                    assertThat(summary.getChunks()).isEqualTo(3);
                })
                .verifyComplete();
    }

    @Test
    void start_LocalWriteFailures_DefersItemsAndContinues() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(25));
        RecordingObserver observer = new RecordingObserver();
        Set<String> broken = Set.of(FakePageFetcher.key(3), FakePageFetcher.key(11), FakePageFetcher.key(20));
        ItemSink sink = failingSink(broken, key -> new LocalWriteException(key, "disk full"));

        // Act & Assert
        StepVerifier.create(engine.coordinator(observer, new LoggingImportObserver()).start(QUERY, 25, sink))
                .assertNext(summary -> {
                    assertThat(summary.getImported()).isEqualTo(22);
                    assertThat(summary.getFailed()).isEqualTo(3);
                    assertThat(summary.getProcessed()).isEqualTo(25);
                    assertThat(summary.getPhase()).isEqualTo(ImportPhase.COMPLETE);
                    assertThat(summary.getFailures()).allSatisfy(failure -> {
                        assertThat(failure.getCategory()).isEqualTo(FaultCategory.LOCAL_IO);
                        assertThat(failure.isDeferred()).isTrue();
                    });
                    assertThat(summary.getErrorReport().getByCategory()).containsEntry(FaultCategory.LOCAL_IO, 3L);
                })
                .verifyComplete();

        assertThat(engine.store.getDeferred()).extracting("itemKey").containsExactlyElementsOf(
                List.of(FakePageFetcher.key(3), FakePageFetcher.key(11), FakePageFetcher.key(20)));
        assertThat(observer.itemErrors).hasSize(3);
        assertThat(engine.statistics.getErrorsByCategory()).containsEntry(FaultCategory.LOCAL_IO, 3L);
    }

    @Test
    void start_InvalidRecord_EndsInErrorRequiringIntervention() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(10));
        ItemSink sink = failingSink(Set.of(FakePageFetcher.key(4)),
                key -> new InvalidItemException(key, "summary missing"));

        // Act & Assert
        StepVerifier.create(engine.coordinator().start(QUERY, 5, sink))
                .assertNext(summary -> {
                    assertThat(summary.getPhase()).isEqualTo(ImportPhase.ERROR);
                    assertThat(summary.getImported()).isEqualTo(9);
                    assertThat(summary.getFailed()).isEqualTo(1);
                    assertThat(summary.requiresIntervention()).isTrue();
                    assertThat(engine.store.loadCheckpoint(summary.getSessionId()).block()).isNotNull();
                })
                .verifyComplete();
    }

    @Test
    void start_InvalidRecord_IsCountedOnceInErrorReport() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(10));
        ItemSink sink = failingSink(Set.of(FakePageFetcher.key(4)),
                key -> new InvalidItemException(key, "summary missing"));

        // Act & Assert
        StepVerifier.create(engine.coordinator().start(QUERY, 5, sink))
                .assertNext(summary -> {
                    ImportSummary.ErrorReport report = summary.getErrorReport();
                    assertThat(summary.getFaults()).hasSize(1);
                    assertThat(report.getTotalErrors()).isEqualTo(1);
                    assertThat((long) report.getTotalErrors()).isEqualTo(summary.getFailed());
                    assertThat(report.getByCategory()).containsExactly(Map.entry(FaultCategory.VALIDATION, 1L));
                    assertThat(report.getItemFailures()).extracting("itemKey").containsExactly(FakePageFetcher.key(4));
                    assertThat(report.getSessionFaults()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void start_TransientItemFailure_RetriesItemAfterBackoff() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(5));
        AtomicInteger failuresLeft = new AtomicInteger(2);
        ItemSink sink = record -> {
            if (record.getKey().equals(FakePageFetcher.key(3)) && failuresLeft.getAndDecrement() > 0) {
                return Mono.error(new ConnectException("Connection refused"));
            }
            appliedKeys.add(record.getKey());
            return Mono.just(ItemCounts.created());
        };
        ProgressiveImportCoordinator coordinator = engine.coordinator();

        // Act & Assert
        StepVerifier.withVirtualTime(() -> coordinator.start(QUERY, 5, sink))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(3))
                .assertNext(summary -> {
                    assertThat(summary.getPhase()).isEqualTo(ImportPhase.COMPLETE);
                    assertThat(summary.getImported()).isEqualTo(5);
                    assertThat(summary.getFailed()).isZero();
                    assertThat(summary.hasErrors()).isFalse();
                })
                .verifyComplete();

        assertThat(appliedKeys).hasSize(5).doesNotHaveDuplicates();
        assertThat(engine.store.getDeferred()).isEmpty();
        assertThat(engine.statistics.getErrorsByCategory()).containsEntry(FaultCategory.NETWORK, 2L);
    }

    @Test
    void pause_DuringItemBackoff_CutsWaitShortAndKeepsCheckpoint() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(10));
        engine.properties.getBackoff().setBaseDelay(Duration.ofSeconds(60));
        engine.properties.getBackoff().setMaxDelay(Duration.ofSeconds(120));
        AtomicInteger failuresLeft = new AtomicInteger(1);
        ItemSink sink = record -> {
            if (record.getKey().equals(FakePageFetcher.key(1)) && failuresLeft.getAndDecrement() > 0) {
                return Mono.error(new ConnectException("Connection refused"));
            }
            appliedKeys.add(record.getKey());
            return Mono.just(ItemCounts.created());
        };
        ProgressiveImportCoordinator coordinator = engine.coordinator();
        AtomicReference<String> sessionId = new AtomicReference<>();

        // Act & Assert
        StepVerifier.withVirtualTime(() -> coordinator.start(QUERY, 5, sink))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(1))
                .then(coordinator::pause)
                .assertNext(summary -> {
                    sessionId.set(summary.getSessionId());
                    assertThat(summary.getPhase()).isEqualTo(ImportPhase.PAUSED);
                    assertThat(summary.getProcessed()).isEqualTo(5);
                    assertThat(summary.getImported()).isEqualTo(5);
                })
                .verifyComplete();

        assertThat(appliedKeys).containsExactly(FakePageFetcher.key(1), FakePageFetcher.key(2),
                FakePageFetcher.key(3), FakePageFetcher.key(4), FakePageFetcher.key(5));
        ImportCheckpoint checkpoint = engine.store.loadCheckpoint(sessionId.get()).block();
        assertThat(checkpoint).isNotNull();
        assertThat(checkpoint.getLastItemKey()).isEqualTo(FakePageFetcher.key(5));
        assertThat(checkpoint.getProcessedCount()).isEqualTo(5);
    }

    @Test
    void start_ConflictingRecord_KeepsLocalVersionAsSkipped() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(5));
        ItemSink sink = failingSink(Set.of(FakePageFetcher.key(2)),
                key -> new ItemConflictException(key, "local edit is newer"));

        // Act & Assert
        StepVerifier.create(engine.coordinator().start(QUERY, 5, sink))
                .assertNext(summary -> {
                    assertThat(summary.getPhase()).isEqualTo(ImportPhase.COMPLETE);
                    assertThat(summary.getCreated()).isEqualTo(4);
                    assertThat(summary.getSkipped()).isEqualTo(1);
                    assertThat(summary.getFailed()).isZero();
                })
                .verifyComplete();
    }

    @Test
    void pauseAndResume_ProcessesRemainingItemsExactlyOnce() {
        // Arrange
        FakePageFetcher fetcher = new FakePageFetcher(100);
        TestEngine engine = new TestEngine(fetcher);
        RecordingObserver observer = new RecordingObserver();
        ProgressiveImportCoordinator coordinator = engine.coordinator(observer);
        observer.hook = event -> {
            if (event.getPhase() == ImportPhase.IMPORTING && event.getProcessed() == 50) {
                coordinator.pause();
            }
        };

        // Act
        ImportSummary paused = coordinator.start(QUERY, 25, creatingSink()).block();

        // Assert
        assertThat(paused).isNotNull();
        assertThat(paused.getPhase()).isEqualTo(ImportPhase.PAUSED);
        assertThat(paused.getProcessed()).isEqualTo(50);
        ImportCheckpoint checkpoint = engine.store.loadCheckpoint(paused.getSessionId()).block();
        assertThat(checkpoint).isNotNull();
        assertThat(checkpoint.getLastItemKey()).isEqualTo(FakePageFetcher.key(50));
        assertThat(checkpoint.getProcessedCount()).isEqualTo(50);

        observer.hook = event -> { };
        StepVerifier.create(coordinator.resume(paused.getSessionId(), creatingSink()))
                .assertNext(resumed -> {
                    assertThat(resumed.getSessionId()).isEqualTo(paused.getSessionId());
                    assertThat(resumed.getPhase()).isEqualTo(ImportPhase.COMPLETE);
                    assertThat(resumed.getResumedFrom()).isEqualTo(FakePageFetcher.key(50));
                    assertThat(resumed.getImported()).isEqualTo(50);
                    assertThat(resumed.getProcessed()).isEqualTo(100);
                    assertThat(resumed.getTotal()).isEqualTo(100);
                })
                .verifyComplete();

        assertThat(appliedKeys).hasSize(100).doesNotHaveDuplicates();
        assertThat(engine.store.loadCheckpoint(paused.getSessionId()).block()).isNull();
    }

    @Test
    void start_WhileAnotherSessionActive_IsRejected() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(10));
        ProgressiveImportCoordinator coordinator = engine.coordinator();
        Sinks.One<ItemCounts> gate = Sinks.one();
        List<ImportSummary> finished = new ArrayList<>();
        coordinator.start(QUERY, 5, record -> gate.asMono()).subscribe(finished::add);
        String activeId = coordinator.getActiveSession().orElseThrow().getSessionId();

        // Act & Assert
        StepVerifier.create(coordinator.start(QUERY, 5, creatingSink()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ImportAlreadyRunningException.class);
                    assertThat(((ImportAlreadyRunningException) error).getActiveSessionId()).isEqualTo(activeId);
                })
                .verify();
        StepVerifier.create(coordinator.resume("other", creatingSink()))
                .expectError(ImportAlreadyRunningException.class)
                .verify();

        assertThat(coordinator.getActiveSession()).map(ImportSession::getSessionId).contains(activeId);
        gate.tryEmitValue(ItemCounts.updated());
        assertThat(finished).singleElement().satisfies(summary -> {
            assertThat(summary.getPhase()).isEqualTo(ImportPhase.COMPLETE);
            assertThat(summary.getUpdated()).isEqualTo(10);
        });
        assertThat(appliedKeys).isEmpty();
        assertThat(coordinator.getActiveSession()).isEmpty();
    }

    @Test
    void resume_WithoutCheckpoint_Fails() {
        TestEngine engine = new TestEngine(new FakePageFetcher(10));

        StepVerifier.create(engine.coordinator().resume("missing-session", creatingSink()))
                .expectError(NothingToResumeException.class)
                .verify();
    }

    @Test
    void start_WhileDegraded_IsRejected() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(10));
        engine.degradedMode.enter("tracker misconfigured");

        // Act & Assert
        StepVerifier.create(engine.coordinator().start(QUERY, 5, creatingSink()))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(DegradedModeException.class)
                        .hasMessageContaining("tracker misconfigured"))
                .verify();
    }

    @Test
    void start_ConfigurationFault_PausesAfterCurrentChunk() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(100));
        ItemSink sink = failingSink(Set.of(FakePageFetcher.key(10)),
                key -> new SyncConfigurationException("field mapping missing"));

        // Act & Assert
        StepVerifier.create(engine.coordinator().start(QUERY, 25, sink))
                .assertNext(summary -> {
                    assertThat(summary.getPhase()).isEqualTo(ImportPhase.PAUSED);
                    assertThat(summary.getProcessed()).isEqualTo(25);
                    assertThat(summary.getFailed()).isEqualTo(1);
                    assertThat(engine.store.loadCheckpoint(summary.getSessionId()).block().getLastItemKey())
                            .isEqualTo(FakePageFetcher.key(25));
                })
                .verifyComplete();

        assertThat(engine.degradedMode.isDegraded()).isTrue();
        assertThat(appliedKeys).hasSize(24);
    }

    @Test
    void cancel_MidRun_EndsCancelledAndKeepsCheckpoint() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(100));
        RecordingObserver observer = new RecordingObserver();
        ProgressiveImportCoordinator coordinator = engine.coordinator(observer);
        observer.hook = event -> {
            if (event.getPhase() == ImportPhase.IMPORTING && event.getProcessed() == 25) {
                coordinator.cancel();
            }
        };

        // Act & Assert
        StepVerifier.create(coordinator.start(QUERY, 25, creatingSink()))
                .assertNext(summary -> {
                    assertThat(summary.getPhase()).isEqualTo(ImportPhase.CANCELLED);
                    assertThat(summary.isCancelled()).isTrue();
                    assertThat(summary.getProcessed()).isEqualTo(25);
                    assertThat(engine.store.loadCheckpoint(summary.getSessionId()).block()).isNotNull();
                })
                .verifyComplete();

        assertThat(coordinator.cancel()).isFalse();
    }

    @Test
    void start_CheckpointWriteFails_EndsInError() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(30));
        engine.store.failCheckpointWrites(true);

        // Act & Assert
        StepVerifier.create(engine.coordinator().start(QUERY, 10, creatingSink()))
                .assertNext(summary -> {
                    assertThat(summary.getPhase()).isEqualTo(ImportPhase.ERROR);
                    assertThat(summary.getFaults()).singleElement()
                            .satisfies(fault -> assertThat(fault.getCategory()).isEqualTo(FaultCategory.LOCAL_IO));
                    assertThat(summary.getChunks()).isZero();
                })
                .verifyComplete();
    }

    @Test
    void start_NonPositiveBatchSize_IsRejected() {
        TestEngine engine = new TestEngine(new FakePageFetcher(10));

        StepVerifier.create(engine.coordinator().start(QUERY, 0, creatingSink()))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void start_MixedOutcomes_CountsAddUpToProcessed() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(40));
        ItemSink sink = record -> {
            int index = Integer.parseInt(record.getKey().substring("ISSUE-".length()));
            if (index % 7 == 0) {
                return Mono.error(new LocalWriteException(record.getKey(), "locked"));
            }
            if (index % 5 == 0) {
                return Mono.empty();
            }
            return Mono.just(index % 2 == 0 ? ItemCounts.updated() : ItemCounts.created());
        };

        // Act
        ImportSummary summary = engine.coordinator().start(QUERY, 15, sink).block();

        // Assert
        assertThat(summary).isNotNull();
        assertThat(summary.getProcessed())
                .isEqualTo(summary.getImported() + summary.getSkipped() + summary.getFailed())
                .isLessThanOrEqualTo(summary.getTotal())
                .isEqualTo(40);
        assertThat(summary.getFailed()).isEqualTo(5);
        assertThat(summary.getSkipped()).isEqualTo(7);
    }

    @Test
    void pause_BeforeFirstChunk_LeavesResumableCheckpoint() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(100));
        RecordingObserver observer = new RecordingObserver();
        ProgressiveImportCoordinator coordinator = engine.coordinator(observer);
        observer.hook = event -> {
            if (event.getPhase() == ImportPhase.FETCHING) {
                coordinator.pause();
            }
        };

        // Act
        ImportSummary paused = coordinator.start(QUERY, 25, creatingSink()).block();

        // Assert
        assertThat(paused).isNotNull();
        assertThat(paused.getPhase()).isEqualTo(ImportPhase.PAUSED);
        assertThat(paused.getProcessed()).isZero();
        assertThat(appliedKeys).isEmpty();
        ImportCheckpoint checkpoint = engine.store.loadCheckpoint(paused.getSessionId()).block();
        assertThat(checkpoint).isNotNull();
        assertThat(checkpoint.getLastItemKey()).isNull();
        assertThat(checkpoint.getProcessedCount()).isZero();

        observer.hook = event -> { };
        StepVerifier.create(coordinator.resume(paused.getSessionId(), creatingSink()))
                .assertNext(resumed -> {
                    assertThat(resumed.getSessionId()).isEqualTo(paused.getSessionId());
                    assertThat(resumed.getPhase()).isEqualTo(ImportPhase.COMPLETE);
                    assertThat(resumed.getImported()).isEqualTo(100);
                    assertThat(resumed.getProcessed()).isEqualTo(100);
                })
                .verifyComplete();

        assertThat(appliedKeys).hasSize(100).doesNotHaveDuplicates();
        assertThat(engine.store.loadCheckpoint(paused.getSessionId()).block()).isNull();
    }

    @Test
    void start_ItemsWithSameKeyOrder_AreAppliedSequentially() {
        // Arrange
        TestEngine engine = new TestEngine(new FakePageFetcher(12));
        List<String> order = new CopyOnWriteArrayList<>();
        ItemSink sink = (IssueRecord record) -> Mono.fromCallable(() -> {
            order.add(record.getKey());
            return ItemCounts.created();
        });

        // Act
        engine.coordinator().start(QUERY, 4, sink).block();

        // Assert
        assertThat(order).isSortedAccordingTo(String::compareTo).hasSize(12);
    }
}

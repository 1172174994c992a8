package com.openrangelabs.donpetre.issuesync.importer;

import com.openrangelabs.donpetre.issuesync.fault.Fault;
import com.openrangelabs.donpetre.issuesync.model.ImportCheckpoint;
import com.openrangelabs.donpetre.issuesync.model.ImportPhase;
import com.openrangelabs.donpetre.issuesync.model.ItemCounts;
import com.openrangelabs.donpetre.issuesync.model.ItemFailure;
import com.openrangelabs.donpetre.issuesync.model.QuerySpec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one import run. Mutated only by the coordinator; readable from any thread.
 *
 * <p>{@code processed = succeeded + failed}, plus the items already processed before
 * the checkpoint when the session was resumed.
 */
public class ImportSession {

    private final String sessionId;
    private final QuerySpec query;
    private final int batchSize;
    private final Instant startedAt;
    private final long processedBefore;
    private final String resumedFrom;

    private volatile ImportPhase phase;
    private volatile long succeeded;
    private volatile long failed;
    private volatile long total;
    private volatile int chunks;
    private volatile String lastProcessedKey;
    private volatile ItemCounts counts = ItemCounts.NONE;
    private final List<ItemFailure> failures = new ArrayList<>();
    private final List<Fault> faults = new ArrayList<>();

    private ImportSession(String sessionId, QuerySpec query, int batchSize, Instant startedAt,
                          ImportPhase phase, long processedBefore, String lastProcessedKey) {
        this.sessionId = sessionId;
        this.query = query;
        this.batchSize = batchSize;
        this.startedAt = startedAt;
        this.phase = phase;
        this.processedBefore = processedBefore;
        this.lastProcessedKey = lastProcessedKey;
        this.resumedFrom = lastProcessedKey;
        this.total = processedBefore;
    }

    static ImportSession start(String sessionId, QuerySpec query, int batchSize, Instant now) {
        return new ImportSession(sessionId, query, batchSize, now, ImportPhase.IDLE, 0, null);
    }

    /**
     * Rebuilds a paused session from its checkpoint
     */
    static ImportSession restore(ImportCheckpoint checkpoint, Instant now) {
        return new ImportSession(checkpoint.getSessionId(), checkpoint.getQuery(), checkpoint.getBatchSize(), now,
                ImportPhase.PAUSED, checkpoint.getProcessedCount(), checkpoint.getLastItemKey());
    }

    void transitionTo(ImportPhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal import transition " + phase + " -> " + next
                    + " for session " + sessionId);
        }
        this.phase = next;
    }

    /**
     * Refines the total estimate with the latest count reported for the running query
     */
    void refineTotal(long reportedForQuery) {
        this.total = Math.max(processedBefore + reportedForQuery, getProcessed());
    }

    synchronized void recordSuccess(String itemKey, ItemCounts itemCounts) {
        this.counts = counts.plus(itemCounts);
        this.succeeded++;
        this.lastProcessedKey = itemKey;
        keepTotalAboveProcessed();
    }

    synchronized void recordFailure(ItemFailure failure) {
        this.failures.add(failure);
        this.failed++;
        this.lastProcessedKey = failure.getItemKey();
        keepTotalAboveProcessed();
    }

    synchronized void addFault(Fault fault) {
        this.faults.add(fault);
    }

    void chunkCompleted() {
        this.chunks++;
    }

    ImportCheckpoint toCheckpoint(Instant now) {
        return new ImportCheckpoint(sessionId, getProcessed(), lastProcessedKey, query, batchSize, now);
    }

    private void keepTotalAboveProcessed() {
        long processed = getProcessed();
        if (total < processed) {
            total = processed;
        }
    }

    // Getters
    public String getSessionId() { return sessionId; }
    public QuerySpec getQuery() { return query; }
    public int getBatchSize() { return batchSize; }
    public Instant getStartedAt() { return startedAt; }
    public ImportPhase getPhase() { return phase; }
    public long getSucceeded() { return succeeded; }
    public long getFailed() { return failed; }
    public long getTotal() { return total; }
    public int getChunks() { return chunks; }
    public String getLastProcessedKey() { return lastProcessedKey; }
    public String getResumedFrom() { return resumedFrom; }
    public ItemCounts getCounts() { return counts; }

    public long getProcessed() {
        return processedBefore + succeeded + failed;
    }

    public synchronized List<ItemFailure> getFailures() {
        return List.copyOf(failures);
    }

    public synchronized List<Fault> getFaults() {
        return List.copyOf(faults);
    }

    @Override
    public String toString() {
        return "ImportSession{" +
                "sessionId='" + sessionId + '\'' +
                ", phase=" + phase +
                ", processed=" + getProcessed() +
                ", total=" + total +
                ", failed=" + failed +
                ", chunks=" + chunks +
                '}';
    }
}

package com.openrangelabs.donpetre.issuesync.importer;

import com.openrangelabs.donpetre.issuesync.model.IssueRecord;
import com.openrangelabs.donpetre.issuesync.query.CancellationToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime companion of an active session: sink, cancellation token and the records
 * fetched but not yet applied.
 */
class ImportRun {

    enum StopReason { PAUSE, CANCEL, DEGRADED }

    private final ImportSession session;
    private final ItemSink sink;
    private final CancellationToken token = new CancellationToken();
    private final List<IssueRecord> buffer = new ArrayList<>();
    private volatile StopReason stopReason;

    ImportRun(ImportSession session, ItemSink sink) {
        this.session = session;
        this.sink = sink;
    }

    /**
     * Asks the run to stop after the current chunk. The first reason wins.
     */
    synchronized void requestStop(StopReason reason) {
        if (stopReason == null) {
            stopReason = reason;
        }
        token.cancel();
    }

    boolean isStopRequested() {
        return stopReason != null;
    }

    /**
     * Adds fetched records and removes every complete chunk from the buffer
     */
    List<List<IssueRecord>> bufferAndDrainChunks(List<IssueRecord> items, int batchSize) {
        buffer.addAll(items);
        List<List<IssueRecord>> chunks = new ArrayList<>();
        while (buffer.size() >= batchSize) {
            List<IssueRecord> head = buffer.subList(0, batchSize);
            chunks.add(new ArrayList<>(head));
            head.clear();
        }
        return chunks;
    }

    /**
     * Removes and returns the trailing partial chunk
     */
    List<IssueRecord> drainRemainder() {
        List<IssueRecord> rest = new ArrayList<>(buffer);
        buffer.clear();
        return rest;
    }

    ImportSession session() { return session; }
    ItemSink sink() { return sink; }
    CancellationToken token() { return token; }
    StopReason stopReason() { return stopReason; }
}

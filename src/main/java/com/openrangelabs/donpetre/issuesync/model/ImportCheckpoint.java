package com.openrangelabs.donpetre.issuesync.model;

import java.time.Instant;

/**
 * Everything needed to continue an interrupted session exactly where it stopped
 */
public class ImportCheckpoint {

    private final String sessionId;
    private final long processedCount;
    private final String lastItemKey;
    private final QuerySpec query;
    private final int batchSize;
    private final Instant savedAt;

    public ImportCheckpoint(String sessionId, long processedCount, String lastItemKey,
                            QuerySpec query, int batchSize, Instant savedAt) {
        this.sessionId = sessionId;
        this.processedCount = processedCount;
        this.lastItemKey = lastItemKey;
        this.query = query;
        this.batchSize = batchSize;
        this.savedAt = savedAt;
    }

    // Getters
    public String getSessionId() { return sessionId; }
    public long getProcessedCount() { return processedCount; }
    public String getLastItemKey() { return lastItemKey; }
    public QuerySpec getQuery() { return query; }
    public int getBatchSize() { return batchSize; }
    public Instant getSavedAt() { return savedAt; }

    @Override
    public String toString() {
        return "ImportCheckpoint{" +
                "sessionId='" + sessionId + '\'' +
                ", processedCount=" + processedCount +
                ", lastItemKey='" + lastItemKey + '\'' +
                ", batchSize=" + batchSize +
                ", savedAt=" + savedAt +
                '}';
    }
}

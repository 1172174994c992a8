package com.openrangelabs.donpetre.issuesync.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Persisted resume point of an import session, one row per session
 */
@Table("import_checkpoints")
public class ImportCheckpointEntity {

    @Id
    private UUID id;

    @Column("session_id")
    private String sessionId;

    @Column("processed_count")
    private Long processedCount = 0L;

    @Column("last_item_key")
    private String lastItemKey;

    @Column("query_text")
    private String queryText;

    /** Comma separated field list */
    @Column("query_fields")
    private String queryFields;

    @Column("page_size")
    private Integer pageSize;

    @Column("max_results")
    private Integer maxResults;

    @Column("batch_size")
    private Integer batchSize;

    @Column("saved_at")
    private LocalDateTime savedAt;

    // Constructors
    public ImportCheckpointEntity() {}

    public ImportCheckpointEntity(String sessionId) {
        this.sessionId = sessionId;
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public Long getProcessedCount() { return processedCount; }
    public void setProcessedCount(Long processedCount) { this.processedCount = processedCount; }

    public String getLastItemKey() { return lastItemKey; }
    public void setLastItemKey(String lastItemKey) { this.lastItemKey = lastItemKey; }

    public String getQueryText() { return queryText; }
    public void setQueryText(String queryText) { this.queryText = queryText; }

    public String getQueryFields() { return queryFields; }
    public void setQueryFields(String queryFields) { this.queryFields = queryFields; }

    public Integer getPageSize() { return pageSize; }
    public void setPageSize(Integer pageSize) { this.pageSize = pageSize; }

    public Integer getMaxResults() { return maxResults; }
    public void setMaxResults(Integer maxResults) { this.maxResults = maxResults; }

    public Integer getBatchSize() { return batchSize; }
    public void setBatchSize(Integer batchSize) { this.batchSize = batchSize; }

    public LocalDateTime getSavedAt() { return savedAt; }
    public void setSavedAt(LocalDateTime savedAt) { this.savedAt = savedAt; }

    @Override
    public String toString() {
        return "ImportCheckpointEntity{" +
                "id=" + id +
                ", sessionId='" + sessionId + '\'' +
                ", processedCount=" + processedCount +
                ", lastItemKey='" + lastItemKey + '\'' +
                ", savedAt=" + savedAt +
                '}';
    }
}

package com.openrangelabs.donpetre.issuesync.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Operation deferred by the queue recovery strategy, waiting for a later replay
 */
@Table("deferred_operations")
public class DeferredOperationEntity {

    @Id
    private UUID id;

    private String operation;

    @Column("item_key")
    private String itemKey;

    /** JSON payload */
    private String payload;

    private Integer attempts = 0;

    @Column("fault_category")
    private String faultCategory;

    @Column("fault_message")
    private String faultMessage;

    private String status;

    @Column("enqueued_at")
    private LocalDateTime enqueuedAt;

    // Constructors
    public DeferredOperationEntity() {}

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getOperation() { return operation; }
    public void setOperation(String operation) { this.operation = operation; }

    public String getItemKey() { return itemKey; }
    public void setItemKey(String itemKey) { this.itemKey = itemKey; }

    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }

    public Integer getAttempts() { return attempts; }
    public void setAttempts(Integer attempts) { this.attempts = attempts; }

    public String getFaultCategory() { return faultCategory; }
    public void setFaultCategory(String faultCategory) { this.faultCategory = faultCategory; }

    public String getFaultMessage() { return faultMessage; }
    public void setFaultMessage(String faultMessage) { this.faultMessage = faultMessage; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public LocalDateTime getEnqueuedAt() { return enqueuedAt; }
    public void setEnqueuedAt(LocalDateTime enqueuedAt) { this.enqueuedAt = enqueuedAt; }

    @Override
    public String toString() {
        return "DeferredOperationEntity{" +
                "id=" + id +
                ", operation='" + operation + '\'' +
                ", itemKey='" + itemKey + '\'' +
                ", faultCategory='" + faultCategory + '\'' +
                ", status='" + status + '\'' +
                '}';
    }
}

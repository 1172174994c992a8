package com.openrangelabs.donpetre.issuesync.store;

import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable descriptor of an operation deferred by the queue strategy
 */
@Value
@Builder(toBuilder = true)
public class DeferredOperation {

    public static final String STATUS_PENDING = "PENDING";

    UUID id;
    String operation;
    String itemKey;
    /** JSON form of the operation payload; may be null */
    String payload;
    int attempts;
    FaultCategory category;
    String faultMessage;
    Instant enqueuedAt;
    @Builder.Default
    String status = STATUS_PENDING;
}

package com.openrangelabs.donpetre.issuesync.model;

import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;
import com.openrangelabs.donpetre.issuesync.fault.RecoveryStrategy;
import lombok.Value;

import java.time.Instant;

/**
 * A record that could not be imported, attributed by key
 */
@Value
public class ItemFailure {
    String itemKey;
    String message;
    FaultCategory category;
    RecoveryStrategy strategy;
    /** true when the item was handed to the deferred queue */
    boolean deferred;
    Instant occurredAt;
}

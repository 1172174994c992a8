package com.openrangelabs.donpetre.issuesync.fault;

/**
 * Recovery strategies applied to classified faults
 */
public enum RecoveryStrategy {
    RETRY,
    QUEUE,
    FALLBACK,
    GRACEFUL_DEGRADATION,
    USER_INTERVENTION;

    /**
     * Whether the strategy resolves the fault without an operator
     */
    public boolean isAutomatic() {
        return this != USER_INTERVENTION;
    }
}

package com.openrangelabs.donpetre.issuesync.recovery;

import com.openrangelabs.donpetre.issuesync.fault.RecoveryStrategy;
import com.openrangelabs.donpetre.issuesync.store.DeferredOperation;

import java.time.Duration;

/**
 * Result of applying a recovery strategy to a fault
 */
public class RecoveryOutcome {

    private final RecoveryStrategy strategy;
    private final boolean success;
    private final int attempts;
    private final boolean retry;
    private final Duration retryDelay;
    private final DeferredOperation deferredOperation;

    private RecoveryOutcome(RecoveryStrategy strategy, boolean success, int attempts,
                            boolean retry, Duration retryDelay, DeferredOperation deferredOperation) {
        this.strategy = strategy;
        this.success = success;
        this.attempts = attempts;
        this.retry = retry;
        this.retryDelay = retryDelay;
        this.deferredOperation = deferredOperation;
    }

    /**
     * The caller should wait {@code delay} and re-issue the same operation
     */
    public static RecoveryOutcome retry(int attempts, Duration delay) {
        return new RecoveryOutcome(RecoveryStrategy.RETRY, true, attempts, true, delay, null);
    }

    public static RecoveryOutcome queued(int attempts, DeferredOperation operation) {
        return new RecoveryOutcome(RecoveryStrategy.QUEUE, true, attempts, false, Duration.ZERO, operation);
    }

    public static RecoveryOutcome recovered(RecoveryStrategy strategy, int attempts) {
        return new RecoveryOutcome(strategy, true, attempts, false, Duration.ZERO, null);
    }

    public static RecoveryOutcome failed(RecoveryStrategy strategy, int attempts) {
        return new RecoveryOutcome(strategy, false, attempts, false, Duration.ZERO, null);
    }

    // Getters
    public RecoveryStrategy getStrategy() { return strategy; }
    public boolean isSuccess() { return success; }
    public int getAttempts() { return attempts; }
    public boolean shouldRetry() { return retry; }
    public Duration getRetryDelay() { return retryDelay; }
    public DeferredOperation getDeferredOperation() { return deferredOperation; }

    public boolean isDeferred() {
        return deferredOperation != null;
    }

    @Override
    public String toString() {
        return "RecoveryOutcome{" +
                "strategy=" + strategy +
                ", success=" + success +
                ", attempts=" + attempts +
                (retry ? ", retryDelay=" + retryDelay : "") +
                (deferredOperation != null ? ", deferred=" + deferredOperation.getItemKey() : "") +
                '}';
    }
}

package com.openrangelabs.donpetre.issuesync.fault;

/**
 * Fault taxonomy with the default severity, strategy and retry ceiling of each category
 */
public enum FaultCategory {

    NETWORK(FaultSeverity.MEDIUM, RecoveryStrategy.RETRY, 5),
    REMOTE_4XX(FaultSeverity.MEDIUM, RecoveryStrategy.QUEUE, 1),
    REMOTE_5XX(FaultSeverity.MEDIUM, RecoveryStrategy.RETRY, 3),
    RATE_LIMIT(FaultSeverity.LOW, RecoveryStrategy.RETRY, 3),
    AUTH(FaultSeverity.HIGH, RecoveryStrategy.USER_INTERVENTION, 1),
    VALIDATION(FaultSeverity.MEDIUM, RecoveryStrategy.USER_INTERVENTION, 1),
    CONFLICT(FaultSeverity.LOW, RecoveryStrategy.FALLBACK, 1),
    CONFIGURATION(FaultSeverity.CRITICAL, RecoveryStrategy.GRACEFUL_DEGRADATION, 1),
    LOCAL_IO(FaultSeverity.MEDIUM, RecoveryStrategy.RETRY, 1),
    UNKNOWN(FaultSeverity.MEDIUM, RecoveryStrategy.RETRY, 1);

    private final FaultSeverity defaultSeverity;
    private final RecoveryStrategy defaultStrategy;
    private final int defaultMaxAttempts;

    FaultCategory(FaultSeverity defaultSeverity, RecoveryStrategy defaultStrategy, int defaultMaxAttempts) {
        this.defaultSeverity = defaultSeverity;
        this.defaultStrategy = defaultStrategy;
        this.defaultMaxAttempts = defaultMaxAttempts;
    }

    public FaultSeverity getDefaultSeverity() { return defaultSeverity; }
    public RecoveryStrategy getDefaultStrategy() { return defaultStrategy; }

    /**
     * Total attempts allowed for the category, the first one included
     */
    public int getDefaultMaxAttempts() { return defaultMaxAttempts; }

    /**
     * Lower-case label used in logs and statistics keys
     */
    public String label() {
        return name().toLowerCase().replace('_', '-');
    }
}

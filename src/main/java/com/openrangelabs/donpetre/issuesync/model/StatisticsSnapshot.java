package com.openrangelabs.donpetre.issuesync.model;

import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;
import com.openrangelabs.donpetre.issuesync.fault.RecoveryStrategy;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of the sync statistics
 */
@Value
@Builder
public class StatisticsSnapshot {

    long totalOperations;
    long succeededOperations;
    long failedOperations;
    long consecutiveFailures;

    long itemsCreated;
    long itemsUpdated;
    long itemsSkipped;
    long itemsTotal;

    double averageDurationMs;
    double averageItemsPerSecond;
    long lastDurationMs;
    long longestDurationMs;

    long apiCallsThisHour;
    Map<FaultCategory, Long> errorsByCategory;
    Map<RecoveryStrategy, Long> recoveriesSucceeded;
    Map<RecoveryStrategy, Long> recoveriesFailed;
    List<HourlyStats> hourly;
    Instant lastSuccessAt;
    Instant lastFailureAt;

    public double getSuccessRate() {
        return totalOperations > 0 ? (double) succeededOperations / totalOperations : 0.0;
    }

    public double getFailureRate() {
        return totalOperations > 0 ? (double) failedOperations / totalOperations : 0.0;
    }
}

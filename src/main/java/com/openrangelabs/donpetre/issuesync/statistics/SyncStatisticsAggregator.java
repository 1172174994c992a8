package com.openrangelabs.donpetre.issuesync.statistics;

import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;
import com.openrangelabs.donpetre.issuesync.fault.RecoveryStrategy;
import com.openrangelabs.donpetre.issuesync.model.ErrorCategorySummary;
import com.openrangelabs.donpetre.issuesync.model.HourlyStats;
import com.openrangelabs.donpetre.issuesync.model.ItemCounts;
import com.openrangelabs.donpetre.issuesync.model.StatisticsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rolling statistics over sync operations.
 *
 * <p>Invariants held after every mutation: {@code total = succeeded + failed} and
 * {@code itemsTotal = created + updated + skipped}. All methods are synchronized on
 * the instance.
 */
@Component
public class SyncStatisticsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(SyncStatisticsAggregator.class);

    static final long HOUR_MS = 3_600_000L;
    static final int RETAINED_HOURS = 24;
    static final long DEFAULT_OVERFLOW_THRESHOLD = Long.MAX_VALUE / 2;

    private final Clock clock;
    private final long overflowThreshold;

    private long totalOperations;
    private long succeededOperations;
    private long failedOperations;
    private long consecutiveFailures;

    private long itemsCreated;
    private long itemsUpdated;
    private long itemsSkipped;
    private long itemsTotal;

    private double durationSumMs;
    private double throughputSum;
    private long throughputSamples;
    private long lastDurationMs;
    private long longestDurationMs;

    private long apiCallsThisHour;
    private long apiCallsHourStart = -1;

    private final Map<FaultCategory, Long> errorsByCategory = new EnumMap<>(FaultCategory.class);
    private final Map<RecoveryStrategy, Long> recoveriesSucceeded = new EnumMap<>(RecoveryStrategy.class);
    private final Map<RecoveryStrategy, Long> recoveriesFailed = new EnumMap<>(RecoveryStrategy.class);
    private final TreeMap<Long, HourBucket> hourly = new TreeMap<>();

    private Instant lastSuccessAt;
    private Instant lastFailureAt;

    @Autowired
    public SyncStatisticsAggregator(Clock clock) {
        this(clock, DEFAULT_OVERFLOW_THRESHOLD);
    }

    SyncStatisticsAggregator(Clock clock, long overflowThreshold) {
        this.clock = clock;
        this.overflowThreshold = overflowThreshold;
    }

    public synchronized void recordSuccess(long durationMs, ItemCounts counts) {
        long duration = Math.max(0, durationMs);
        long now = clock.millis();

        totalOperations++;
        succeededOperations++;
        consecutiveFailures = 0;

        lastDurationMs = duration;
        longestDurationMs = Math.max(longestDurationMs, duration);
        durationSumMs += duration;

        itemsCreated += counts.getCreated();
        itemsUpdated += counts.getUpdated();
        itemsSkipped += counts.getSkipped();
        itemsTotal = itemsCreated + itemsUpdated + itemsSkipped;

        if (duration > 0) {
            throughputSum += counts.total() / (duration / 1000.0);
            throughputSamples++;
        }

        HourBucket bucket = bucketFor(now);
        bucket.operations++;
        bucket.items += counts.total();

        lastSuccessAt = Instant.ofEpochMilli(now);
        rescaleIfNeeded();
    }

    public synchronized void recordFailure(FaultCategory category) {
        long now = clock.millis();

        totalOperations++;
        failedOperations++;
        consecutiveFailures++;
        errorsByCategory.merge(category, 1L, Long::sum);

        HourBucket bucket = bucketFor(now);
        bucket.operations++;
        bucket.errors++;

        lastFailureAt = Instant.ofEpochMilli(now);
        rescaleIfNeeded();
    }

    public synchronized void recordApiCalls(int calls) {
        rollApiHour(clock.millis());
        apiCallsThisHour += Math.max(0, calls);
    }

    public synchronized void recordRecovery(RecoveryStrategy strategy, boolean success) {
        (success ? recoveriesSucceeded : recoveriesFailed).merge(strategy, 1L, Long::sum);
    }

    // Accessors

    public synchronized long getTotalOperations() { return totalOperations; }
    public synchronized long getSucceededOperations() { return succeededOperations; }
    public synchronized long getFailedOperations() { return failedOperations; }
    public synchronized long getConsecutiveFailures() { return consecutiveFailures; }
    public synchronized long getItemsTotal() { return itemsTotal; }
    public synchronized long getLastDurationMs() { return lastDurationMs; }
    public synchronized long getLongestDurationMs() { return longestDurationMs; }

    public synchronized double getAverageDurationMs() {
        return succeededOperations > 0 ? durationSumMs / succeededOperations : 0.0;
    }

    /**
     * Unweighted mean of the per-operation throughput samples
     */
    public synchronized double getAverageItemsPerSecond() {
        return throughputSamples > 0 ? throughputSum / throughputSamples : 0.0;
    }

    public synchronized long getApiCallsThisHour() {
        rollApiHour(clock.millis());
        return apiCallsThisHour;
    }

    public synchronized Map<FaultCategory, Long> getErrorsByCategory() {
        return copy(errorsByCategory, FaultCategory.class);
    }

    public synchronized ErrorCategorySummary getErrorCategorySummary() {
        long total = 0;
        FaultCategory mostCommon = null;
        long mostCommonCount = 0;
        for (Map.Entry<FaultCategory, Long> entry : errorsByCategory.entrySet()) {
            total += entry.getValue();
            if (entry.getValue() > mostCommonCount) {
                mostCommon = entry.getKey();
                mostCommonCount = entry.getValue();
            }
        }
        return new ErrorCategorySummary(total, mostCommon, errorsByCategory.size());
    }

    /**
     * Retained hourly buckets, oldest first
     */
    public synchronized List<HourlyStats> getHourlyStats() {
        List<HourlyStats> result = new ArrayList<>(hourly.size());
        hourly.forEach((start, bucket) -> result.add(bucket.toStats(start)));
        return result;
    }

    /**
     * Hourly buckets whose start lies in {@code [from, to)}
     */
    public synchronized List<HourlyStats> getHourlyRange(Instant from, Instant to) {
        List<HourlyStats> result = new ArrayList<>();
        hourly.subMap(from.toEpochMilli(), true, to.toEpochMilli(), false)
                .forEach((start, bucket) -> result.add(bucket.toStats(start)));
        return result;
    }

    /**
     * Sum over the retained window; the hour start is the oldest retained bucket
     */
    public synchronized HourlyStats getLast24HoursTotals() {
        long operations = 0;
        long items = 0;
        long errors = 0;
        for (HourBucket bucket : hourly.values()) {
            operations += bucket.operations;
            items += bucket.items;
            errors += bucket.errors;
        }
        Instant start = hourly.isEmpty()
                ? Instant.ofEpochMilli(hourStart(clock.millis()))
                : Instant.ofEpochMilli(hourly.firstKey());
        return new HourlyStats(start, operations, items, errors);
    }

    public synchronized StatisticsSnapshot snapshot() {
        return StatisticsSnapshot.builder()
                .totalOperations(totalOperations)
                .succeededOperations(succeededOperations)
                .failedOperations(failedOperations)
                .consecutiveFailures(consecutiveFailures)
                .itemsCreated(itemsCreated)
                .itemsUpdated(itemsUpdated)
                .itemsSkipped(itemsSkipped)
                .itemsTotal(itemsTotal)
                .averageDurationMs(getAverageDurationMs())
                .averageItemsPerSecond(getAverageItemsPerSecond())
                .lastDurationMs(lastDurationMs)
                .longestDurationMs(longestDurationMs)
                .apiCallsThisHour(getApiCallsThisHour())
                .errorsByCategory(copy(errorsByCategory, FaultCategory.class))
                .recoveriesSucceeded(copy(recoveriesSucceeded, RecoveryStrategy.class))
                .recoveriesFailed(copy(recoveriesFailed, RecoveryStrategy.class))
                .hourly(getHourlyStats())
                .lastSuccessAt(lastSuccessAt)
                .lastFailureAt(lastFailureAt)
                .build();
    }

    public synchronized void reset() {
        totalOperations = 0;
        succeededOperations = 0;
        failedOperations = 0;
        consecutiveFailures = 0;
        itemsCreated = 0;
        itemsUpdated = 0;
        itemsSkipped = 0;
        itemsTotal = 0;
        durationSumMs = 0;
        throughputSum = 0;
        throughputSamples = 0;
        lastDurationMs = 0;
        longestDurationMs = 0;
        apiCallsThisHour = 0;
        apiCallsHourStart = -1;
        errorsByCategory.clear();
        recoveriesSucceeded.clear();
        recoveriesFailed.clear();
        hourly.clear();
        lastSuccessAt = null;
        lastFailureAt = null;
    }

    private HourBucket bucketFor(long nowMs) {
        HourBucket bucket = hourly.computeIfAbsent(hourStart(nowMs), start -> new HourBucket());
        while (hourly.size() > RETAINED_HOURS) {
            hourly.pollFirstEntry();
        }
        return bucket;
    }

    private void rollApiHour(long nowMs) {
        long start = hourStart(nowMs);
        if (start != apiCallsHourStart) {
            apiCallsHourStart = start;
            apiCallsThisHour = 0;
        }
    }

    private static long hourStart(long epochMs) {
        return Math.floorDiv(epochMs, HOUR_MS) * HOUR_MS;
    }

    private void rescaleIfNeeded() {
        long largestError = errorsByCategory.values().stream().mapToLong(Long::longValue).max().orElse(0);
        if (totalOperations <= overflowThreshold
                && itemsTotal <= overflowThreshold
                && largestError <= overflowThreshold) {
            return;
        }

        double averageDuration = getAverageDurationMs();
        double averageThroughput = getAverageItemsPerSecond();
        double factor;

        if (totalOperations >= 10) {
            long scaledTotal = Math.max(totalOperations / 100, 10);
            factor = (double) scaledTotal / totalOperations;
            double successRatio = (double) succeededOperations / totalOperations;
            long scaledSucceeded = Math.round(scaledTotal * successRatio);
            succeededOperations = scaledSucceeded;
            failedOperations = scaledTotal - scaledSucceeded;
            totalOperations = scaledTotal;
            consecutiveFailures = Math.min(consecutiveFailures, failedOperations);
        } else {
            factor = 0.01;
        }

        itemsCreated = (long) Math.floor(itemsCreated * factor);
        itemsUpdated = (long) Math.floor(itemsUpdated * factor);
        itemsSkipped = (long) Math.floor(itemsSkipped * factor);
        itemsTotal = itemsCreated + itemsUpdated + itemsSkipped;

        durationSumMs = averageDuration * succeededOperations;
        if (throughputSamples > 0) {
            throughputSamples = Math.max(1, Math.round(throughputSamples * factor));
            throughputSum = averageThroughput * throughputSamples;
        }

        scaleCounts(errorsByCategory, factor);
        scaleCounts(recoveriesSucceeded, factor);
        scaleCounts(recoveriesFailed, factor);

        logger.info("Statistics counters rescaled by {} (total operations now {})", factor, totalOperations);
    }

    private static <K> void scaleCounts(Map<K, Long> counts, double factor) {
        counts.replaceAll((key, value) -> value > 0 ? Math.max(1, Math.round(value * factor)) : 0);
    }

    private static <K extends Enum<K>> Map<K, Long> copy(Map<K, Long> source, Class<K> type) {
        Map<K, Long> copy = new EnumMap<>(type);
        copy.putAll(source);
        return copy;
    }

    private static final class HourBucket {
        long operations;
        long items;
        long errors;

        HourlyStats toStats(long start) {
            return new HourlyStats(Instant.ofEpochMilli(start), operations, items, errors);
        }
    }
}

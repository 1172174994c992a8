package com.openrangelabs.donpetre.issuesync.model;

import com.openrangelabs.donpetre.issuesync.fault.Fault;
import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Final report of an import session.
 *
 * <p>Counts cover the items applied by this run; {@code processed} also includes the
 * items a resumed session had already handled before its checkpoint.
 */
public class ImportSummary {

    private final String sessionId;
    private final ImportPhase phase;
    private final long created;
    private final long updated;
    private final long skipped;
    private final long failed;
    private final long processed;
    private final long total;
    private final int chunks;
    private final Duration elapsed;
    private final List<ItemFailure> failures;
    private final List<Fault> faults;
    private final String resumedFrom;
    private final boolean cancelled;

    private ImportSummary(Builder builder) {
        this.sessionId = builder.sessionId;
        this.phase = builder.phase;
        this.created = builder.created;
        this.updated = builder.updated;
        this.skipped = builder.skipped;
        this.failed = builder.failed;
        this.processed = builder.processed;
        this.total = builder.total;
        this.chunks = builder.chunks;
        this.elapsed = builder.elapsed;
        this.failures = List.copyOf(builder.failures);
        this.faults = List.copyOf(builder.faults);
        this.resumedFrom = builder.resumedFrom;
        this.cancelled = builder.cancelled;
    }

    public static Builder builder(String sessionId) {
        return new Builder(sessionId);
    }

    /**
     * Records written by the sink, created or updated
     */
    public long getImported() {
        return created + updated;
    }

    /**
     * Throughput of this session over its own elapsed time, retries and backoff waits included
     */
    public double getAverageItemsPerSecond() {
        long millis = elapsed.toMillis();
        if (millis <= 0) {
            return 0.0;
        }
        return (created + updated + skipped + failed) / (millis / 1000.0);
    }

    public boolean requiresIntervention() {
        return faults.stream().anyMatch(Fault::requiresIntervention);
    }

    public boolean hasErrors() {
        return !failures.isEmpty() || !faults.isEmpty();
    }

    /**
     * Item failures plus the faults not tied to an item. An item fault that also ended
     * up in {@link #getFaults()} is counted once, through its item failure.
     */
    public ErrorReport getErrorReport() {
        List<Fault> sessionFaults = faults.stream()
                .filter(fault -> fault.getContext() == null || !fault.getContext().isItemLevel())
                .toList();
        Map<FaultCategory, Long> byCategory = new EnumMap<>(FaultCategory.class);
        for (ItemFailure failure : failures) {
            byCategory.merge(failure.getCategory(), 1L, Long::sum);
        }
        for (Fault fault : sessionFaults) {
            byCategory.merge(fault.getCategory(), 1L, Long::sum);
        }
        return new ErrorReport(failures.size() + sessionFaults.size(), byCategory, failures, sessionFaults);
    }

    // Getters
    public String getSessionId() { return sessionId; }
    public ImportPhase getPhase() { return phase; }
    public long getCreated() { return created; }
    public long getUpdated() { return updated; }
    public long getSkipped() { return skipped; }
    public long getFailed() { return failed; }
    public long getProcessed() { return processed; }
    public long getTotal() { return total; }
    public int getChunks() { return chunks; }
    public Duration getElapsed() { return elapsed; }
    public List<ItemFailure> getFailures() { return failures; }
    public List<Fault> getFaults() { return faults; }
    public String getResumedFrom() { return resumedFrom; }
    public boolean isCancelled() { return cancelled; }

    /**
     * Errors of a session grouped by category
     */
    public static class ErrorReport {
        private final int totalErrors;
        private final Map<FaultCategory, Long> byCategory;
        private final List<ItemFailure> itemFailures;
        private final List<Fault> sessionFaults;

        ErrorReport(int totalErrors, Map<FaultCategory, Long> byCategory,
                    List<ItemFailure> itemFailures, List<Fault> sessionFaults) {
            this.totalErrors = totalErrors;
            this.byCategory = Collections.unmodifiableMap(byCategory);
            this.itemFailures = itemFailures;
            this.sessionFaults = sessionFaults;
        }

        public int getTotalErrors() { return totalErrors; }
        public Map<FaultCategory, Long> getByCategory() { return byCategory; }
        public List<ItemFailure> getItemFailures() { return itemFailures; }
        public List<Fault> getSessionFaults() { return sessionFaults; }
    }

    public static class Builder {
        private final String sessionId;
        private ImportPhase phase = ImportPhase.IDLE;
        private long created;
        private long updated;
        private long skipped;
        private long failed;
        private long processed;
        private long total;
        private int chunks;
        private Duration elapsed = Duration.ZERO;
        private List<ItemFailure> failures = new ArrayList<>();
        private List<Fault> faults = new ArrayList<>();
        private String resumedFrom;
        private boolean cancelled;

        private Builder(String sessionId) {
            this.sessionId = sessionId;
        }

        public Builder phase(ImportPhase phase) {
            this.phase = phase;
            return this;
        }

        public Builder counts(ItemCounts counts) {
            this.created = counts.getCreated();
            this.updated = counts.getUpdated();
            this.skipped = counts.getSkipped();
            return this;
        }

        public Builder failed(long failed) {
            this.failed = failed;
            return this;
        }

        public Builder processed(long processed) {
            this.processed = processed;
            return this;
        }

        public Builder total(long total) {
            this.total = total;
            return this;
        }

        public Builder chunks(int chunks) {
            this.chunks = chunks;
            return this;
        }

        public Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed;
            return this;
        }

        public Builder failures(List<ItemFailure> failures) {
            this.failures = new ArrayList<>(failures);
            return this;
        }

        public Builder faults(List<Fault> faults) {
            this.faults = new ArrayList<>(faults);
            return this;
        }

        public Builder resumedFrom(String resumedFrom) {
            this.resumedFrom = resumedFrom;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public ImportSummary build() {
            return new ImportSummary(this);
        }
    }

    @Override
    public String toString() {
        return "ImportSummary{" +
                "sessionId='" + sessionId + '\'' +
                ", phase=" + phase +
                ", imported=" + getImported() +
                ", skipped=" + skipped +
                ", failed=" + failed +
                ", processed=" + processed +
                ", total=" + total +
                ", chunks=" + chunks +
                ", elapsed=" + elapsed +
                (resumedFrom != null ? ", resumedFrom='" + resumedFrom + '\'' : "") +
                '}';
    }
}

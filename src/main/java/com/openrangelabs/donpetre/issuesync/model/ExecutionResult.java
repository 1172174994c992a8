package com.openrangelabs.donpetre.issuesync.model;

import com.openrangelabs.donpetre.issuesync.fault.Fault;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one paginated query run
 */
public class ExecutionResult {

    private final long itemsFetched;
    private final long total;
    private final boolean truncated;
    private final boolean cancelled;
    private final List<Fault> faults;
    private final int apiCalls;

    private ExecutionResult(Builder builder) {
        this.itemsFetched = builder.itemsFetched;
        this.total = builder.total;
        this.truncated = builder.truncated;
        this.cancelled = builder.cancelled;
        this.faults = List.copyOf(builder.faults);
        this.apiCalls = builder.apiCalls;
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters
    public long getItemsFetched() { return itemsFetched; }
    public long getTotal() { return total; }
    public boolean isTruncated() { return truncated; }
    public boolean isCancelled() { return cancelled; }
    public List<Fault> getFaults() { return faults; }
    public int getApiCalls() { return apiCalls; }

    public boolean hasFaults() {
        return !faults.isEmpty();
    }

    public static class Builder {
        private long itemsFetched;
        private long total;
        private boolean truncated;
        private boolean cancelled;
        private final List<Fault> faults = new ArrayList<>();
        private int apiCalls;

        private Builder() {
        }

        public Builder itemsFetched(long itemsFetched) {
            this.itemsFetched = itemsFetched;
            return this;
        }

        public Builder total(long total) {
            this.total = total;
            return this;
        }

        public Builder truncated(boolean truncated) {
            this.truncated = truncated;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder addFault(Fault fault) {
            this.faults.add(fault);
            return this;
        }

        public Builder faults(List<Fault> faults) {
            this.faults.addAll(faults);
            return this;
        }

        public Builder apiCalls(int apiCalls) {
            this.apiCalls = apiCalls;
            return this;
        }

        public ExecutionResult build() {
            return new ExecutionResult(this);
        }
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
                "itemsFetched=" + itemsFetched +
                ", total=" + total +
                ", truncated=" + truncated +
                ", cancelled=" + cancelled +
                ", faults=" + faults.size() +
                ", apiCalls=" + apiCalls +
                '}';
    }
}

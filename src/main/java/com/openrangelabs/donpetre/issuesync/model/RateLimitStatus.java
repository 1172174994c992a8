package com.openrangelabs.donpetre.issuesync.model;

import java.time.Duration;

/**
 * Snapshot of the client-side request budget
 */
public class RateLimitStatus {

    private final int limit;
    private final int remaining;
    private final Duration untilNextPermit;

    public RateLimitStatus(int limit, int remaining, Duration untilNextPermit) {
        this.limit = limit;
        this.remaining = remaining;
        this.untilNextPermit = untilNextPermit;
    }

    public boolean isExceeded() {
        return remaining <= 0;
    }

    // Getters
    public int getLimit() { return limit; }
    public int getRemaining() { return remaining; }
    public Duration getUntilNextPermit() { return untilNextPermit; }

    @Override
    public String toString() {
        return "RateLimitStatus{" +
                "limit=" + limit +
                ", remaining=" + remaining +
                ", untilNextPermit=" + untilNextPermit +
                '}';
    }
}

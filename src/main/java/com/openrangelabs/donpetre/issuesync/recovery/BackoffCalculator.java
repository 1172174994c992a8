package com.openrangelabs.donpetre.issuesync.recovery;

import com.openrangelabs.donpetre.issuesync.config.SyncProperties;
import org.springframework.stereotype.Component;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code min(max, base * 2^(attempt - 1))}, optionally jittered
 * uniformly over {@code [0, computed]}.
 */
@Component
public class BackoffCalculator {

    private final Random random;

    public BackoffCalculator() {
        this(null);
    }

    BackoffCalculator(Random random) {
        this.random = random;
    }

    public long delay(int attempt, SyncProperties.Backoff backoff) {
        return delay(attempt, backoff.getBaseDelay().toMillis(), backoff.getMaxDelay().toMillis(), backoff.isJitter());
    }

    /**
     * Delay in milliseconds before the given attempt is re-issued.
     *
     * @param attempt 1-based attempt number; values below 1 are treated as 1
     * @param baseMs delay of the first attempt
     * @param maxMs upper bound of the computed delay
     * @param jitter whether to pick a uniform value in {@code [0, computed]}
     */
    public long delay(int attempt, long baseMs, long maxMs, boolean jitter) {
        long computed = exponential(Math.max(attempt, 1), baseMs, maxMs);
        if (!jitter || computed == 0) {
            return computed;
        }
        double fraction = nextDouble();
        return Math.min(computed, (long) Math.floor(fraction * (computed + 1)));
    }

    private static long exponential(int attempt, long baseMs, long maxMs) {
        if (baseMs <= 0 || maxMs <= 0) {
            return 0;
        }
        int exponent = attempt - 1;
        if (exponent >= 62) {
            return maxMs;
        }
        long factor = 1L << exponent;
        if (baseMs > Long.MAX_VALUE / factor) {
            return maxMs;
        }
        return Math.min(maxMs, baseMs * factor);
    }

    private double nextDouble() {
        return random != null ? random.nextDouble() : ThreadLocalRandom.current().nextDouble();
    }
}

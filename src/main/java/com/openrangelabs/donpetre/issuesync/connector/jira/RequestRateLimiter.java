package com.openrangelabs.donpetre.issuesync.connector.jira;

import com.openrangelabs.donpetre.issuesync.config.SyncProperties;
import com.openrangelabs.donpetre.issuesync.model.RateLimitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Client-side token bucket in front of the search API.
 *
 * <p>Permits are reserved up front: a caller that finds the bucket empty takes a permit
 * from the future and waits until it has been refilled, so concurrent callers are
 * spaced out instead of retrying in a loop.
 */
@Component
public class RequestRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RequestRateLimiter.class);

    private final int capacity;
    private final double permitsPerNano;
    private final LongSupplier nanoTime;

    private double permits;
    private long lastRefill;

    @Autowired
    public RequestRateLimiter(SyncProperties properties) {
        this(properties.getJira().getRequestsPerMinute(), properties.getJira().getBurst(), System::nanoTime);
    }

    RequestRateLimiter(int requestsPerMinute, int burst, LongSupplier nanoTime) {
        if (requestsPerMinute < 1 || burst < 1) {
            throw new IllegalArgumentException("Rate limit and burst must be positive");
        }
        this.capacity = burst;
        this.permitsPerNano = requestsPerMinute / (double) Duration.ofMinutes(1).toNanos();
        this.nanoTime = nanoTime;
        this.permits = burst;
        this.lastRefill = nanoTime.getAsLong();
    }

    /**
     * Completes once the caller may send one request
     */
    public Mono<Void> acquire() {
        return Mono.defer(() -> {
            Duration wait = reserve();
            if (wait.isZero()) {
                return Mono.empty();
            }
            logger.debug("Rate limit reached, waiting {} ms", wait.toMillis());
            return Mono.delay(wait).then();
        });
    }

    /**
     * Takes one permit and returns how long the caller must wait before using it
     */
    synchronized Duration reserve() {
        refill();
        permits -= 1;
        if (permits >= 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos((long) Math.ceil(-permits / permitsPerNano));
    }

    public synchronized RateLimitStatus getStatus() {
        refill();
        int remaining = (int) Math.floor(Math.max(0, permits));
        Duration untilNext = permits >= 1
                ? Duration.ZERO
                : Duration.ofNanos((long) Math.ceil((1 - permits) / permitsPerNano));
        return new RateLimitStatus(capacity, remaining, untilNext);
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefill;
        if (elapsed > 0) {
            permits = Math.min(capacity, permits + elapsed * permitsPerNano);
            lastRefill = now;
        }
    }
}

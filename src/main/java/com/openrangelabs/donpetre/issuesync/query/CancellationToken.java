package com.openrangelabs.donpetre.issuesync.query;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between a caller and a running query.
 * Once cancelled it stays cancelled.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.Empty<Void> signal = Sinks.empty();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.tryEmitEmpty();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Completes when the token is cancelled, immediately if it already is
     */
    public Mono<Void> whenCancelled() {
        return signal.asMono();
    }

    /**
     * Waits for the delay, ending early if the token is cancelled meanwhile
     */
    public Mono<Void> sleep(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return Mono.empty();
        }
        return Mono.firstWithSignal(Mono.delay(delay).then(), whenCancelled());
    }
}
